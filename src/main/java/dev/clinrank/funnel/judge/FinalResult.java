package dev.clinrank.funnel.judge;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.jspecify.annotations.Nullable;

/**
 * Judge output: a finally ranked chunk. One line of {@code final.jsonl}.
 *
 * <p>{@code patient_uid} is always written; it is {@code null} when the chunk's note has no
 * identity link.
 *
 * @param chunkId the chunk
 * @param calibratedScore calibrated relevance in [0, 1]
 * @param patientUid the linked patient, or null when unknown
 * @param pointer where the chunk sits in its source note
 */
@JsonPropertyOrder({"chunk_id", "calibrated_score", "patient_uid", "pointer"})
public record FinalResult(
    @NotBlank @JsonProperty("chunk_id") String chunkId,
    @DecimalMin("0.0") @DecimalMax("1.0") @JsonProperty(value = "calibrated_score", required = true)
        double calibratedScore,
    @JsonProperty("patient_uid") @JsonInclude(JsonInclude.Include.ALWAYS) @Nullable
        String patientUid,
    @NotNull @Valid @JsonProperty("pointer") Pointer pointer) {}
