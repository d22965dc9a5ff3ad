package dev.clinrank.funnel.judge;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * One labelled reference point for calibration: a raw pairwise score and whether the pair was
 * judged relevant.
 *
 * @param rawScore raw scorer output
 * @param label 1 for relevant, 0 for not relevant
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CalibrationSample(
    @JsonProperty(value = "raw_score", required = true) double rawScore,
    @Min(0) @Max(1) @JsonProperty(value = "label", required = true) int label) {}
