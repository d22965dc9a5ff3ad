package dev.clinrank.funnel.scout;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;

/**
 * Scout output: a chunk with its normalised lexical and dense scores and the fused score derived
 * from them. One line of {@code candidates.jsonl}.
 *
 * @param chunkId the chunk
 * @param lexicalScore min-max normalised lexical score in [0, 1]
 * @param denseScore min-max normalised dense score in [0, 1]
 * @param fusionScore weighted fusion of the two normalised scores, in [0, 1]
 * @param sourceNoteId the note the chunk came from
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"chunk_id", "s_lexical", "s_dense", "fusion_score", "source_note_id"})
public record Candidate(
    @NotBlank @JsonProperty("chunk_id") String chunkId,
    @DecimalMin("0.0") @DecimalMax("1.0") @JsonProperty(value = "s_lexical", required = true)
        double lexicalScore,
    @DecimalMin("0.0") @DecimalMax("1.0") @JsonProperty(value = "s_dense", required = true)
        double denseScore,
    @DecimalMin("0.0") @DecimalMax("1.0") @JsonProperty(value = "fusion_score", required = true)
        double fusionScore,
    @NotBlank @JsonProperty("source_note_id") String sourceNoteId) {}
