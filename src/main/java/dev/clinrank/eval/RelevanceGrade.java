package dev.clinrank.eval;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Graded relevance judgment of one chunk for the evaluated query. Grade 0 is not relevant; any
 * grade of 1 or more counts as relevant and higher grades weigh more in nDCG.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RelevanceGrade(
    @NotBlank @JsonProperty("chunk_id") String chunkId,
    @PositiveOrZero @JsonProperty(value = "grade", required = true) int grade) {}
