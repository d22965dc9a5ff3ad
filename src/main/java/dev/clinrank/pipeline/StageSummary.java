package dev.clinrank.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.clinrank.funnel.inspect.InspectorStage;
import dev.clinrank.funnel.judge.CalibrationFit;
import dev.clinrank.funnel.judge.JudgeStage;
import dev.clinrank.funnel.scout.ScoutResult;
import dev.clinrank.funnel.scout.ScoutStage;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Diagnostics written next to each stage's output as {@code <stage>-summary.json}.
 *
 * <p>The query is recorded so the next stage can run without repeating it. Stage-specific fields
 * are omitted for the other stages: hit counts and phase timings for Scout, the calibration flag
 * and the number of results with a patient for Judge.
 *
 * @param stage stage name
 * @param query the query the stage ran with
 * @param inputCount records received (chunks searched for Scout, candidates otherwise)
 * @param outputCount records emitted
 * @param limit the stage's K
 * @param skippedLines malformed or invalid input lines that were skipped
 * @param lexicalHits hits returned by the lexical index
 * @param denseHits hits returned by the dense index
 * @param patientUidAttached emitted results carrying a patient_uid
 * @param calibrated whether Judge scores are calibrated
 * @param calibration how the calibration was obtained, or why it fell back to identity
 * @param phaseMillis wall-clock time per stage phase, in execution order
 * @param elapsedMillis wall-clock stage time including file I/O
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
  "stage",
  "query",
  "input_count",
  "output_count",
  "limit",
  "skipped_lines",
  "lexical_hits",
  "dense_hits",
  "patient_uid_attached",
  "calibrated",
  "calibration",
  "phase_millis",
  "elapsed_millis"
})
public record StageSummary(
    @JsonProperty("stage") String stage,
    @JsonProperty("query") String query,
    @JsonProperty("input_count") int inputCount,
    @JsonProperty("output_count") int outputCount,
    @JsonProperty("limit") int limit,
    @JsonProperty("skipped_lines") int skippedLines,
    @JsonProperty("lexical_hits") @Nullable Integer lexicalHits,
    @JsonProperty("dense_hits") @Nullable Integer denseHits,
    @JsonProperty("patient_uid_attached") @Nullable Integer patientUidAttached,
    @JsonProperty("calibrated") @Nullable Boolean calibrated,
    @JsonProperty("calibration") @Nullable String calibration,
    @JsonProperty("phase_millis") @Nullable Map<String, Long> phaseMillis,
    @JsonProperty("elapsed_millis") long elapsedMillis) {

  public StageSummary {
    phaseMillis =
        phaseMillis == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(phaseMillis));
  }

  /** File name of the summary written for {@code stage}. */
  public static String fileName(String stage) {
    return stage + "-summary.json";
  }

  static StageSummary scout(
      String query, int chunks, int limit, int skippedLines, ScoutResult result, long elapsed) {
    Map<String, Long> phases = new LinkedHashMap<>();
    phases.put("lexical_search", result.lexicalMillis());
    phases.put("dense_search", result.denseMillis());
    phases.put("fusion", result.fusionMillis());
    return new StageSummary(
        ScoutStage.NAME,
        query,
        chunks,
        result.candidates().size(),
        limit,
        skippedLines,
        result.lexicalHits(),
        result.denseHits(),
        null,
        null,
        null,
        phases,
        elapsed);
  }

  static StageSummary inspect(
      String query, int inputCount, int outputCount, int limit, int skippedLines, long elapsed) {
    return new StageSummary(
        InspectorStage.NAME,
        query,
        inputCount,
        outputCount,
        limit,
        skippedLines,
        null,
        null,
        null,
        null,
        null,
        null,
        elapsed);
  }

  static StageSummary judge(
      String query,
      int inputCount,
      int outputCount,
      int limit,
      int skippedLines,
      int patientUidAttached,
      CalibrationFit calibration,
      long elapsed) {
    return new StageSummary(
        JudgeStage.NAME,
        query,
        inputCount,
        outputCount,
        limit,
        skippedLines,
        null,
        null,
        patientUidAttached,
        calibration.calibrated(),
        calibration.description(),
        null,
        elapsed);
  }
}
