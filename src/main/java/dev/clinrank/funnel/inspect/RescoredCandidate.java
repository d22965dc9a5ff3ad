package dev.clinrank.funnel.inspect;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Inspector output: a Scout candidate re-scored with the interaction signal. One line of {@code
 * rescored.jsonl}.
 *
 * @param chunkId the chunk
 * @param interactionScore interaction score in [0, 1]; the stage's ranking key
 * @param fusionScore Scout fusion score, carried unchanged
 * @param sourceNoteId the note the chunk came from
 * @param evidence top contributing tokens by descending weight; null when evidence is disabled
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"chunk_id", "s_interaction", "fusion_score", "source_note_id", "evidence"})
public record RescoredCandidate(
    @NotBlank @JsonProperty("chunk_id") String chunkId,
    @DecimalMin("0.0") @DecimalMax("1.0") @JsonProperty(value = "s_interaction", required = true)
        double interactionScore,
    @DecimalMin("0.0") @DecimalMax("1.0") @JsonProperty(value = "fusion_score", required = true)
        double fusionScore,
    @NotBlank @JsonProperty("source_note_id") String sourceNoteId,
    @JsonProperty("evidence") @Nullable List<@Valid Evidence> evidence) {

  public RescoredCandidate {
    evidence = evidence == null ? null : List.copyOf(evidence);
  }
}
