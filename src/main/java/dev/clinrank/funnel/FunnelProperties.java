package dev.clinrank.funnel;

import dev.clinrank.funnel.judge.CalibrationMethod;
import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for the ranking funnel.
 *
 * <p>Properties are bound from {@code clinrank.funnel.*} in application.yml or from command line
 * arguments such as {@code --clinrank.funnel.scout-limit=100}.
 *
 * <ul>
 *   <li>{@code scout-limit}, {@code inspector-limit}, {@code judge-limit} - K_A, K_B and K_C,
 *       the stage output limits (default 200, 50, 10; must satisfy K_A >= K_B >= K_C >= 1)
 *   <li>{@code lexical-k1}, {@code lexical-b} - BM25 parameters (default 0.9, 0.4)
 *   <li>{@code fusion-weight-lexical}, {@code fusion-weight-dense} - fusion weights, summing to
 *       1.0 (default 0.5 each)
 *   <li>{@code candidates-per-mechanism} - hits fetched from each index before fusion (default 0,
 *       meaning K_A)
 *   <li>{@code evidence-size} - evidence tokens kept per Inspector candidate (default 10, 0
 *       disables evidence)
 *   <li>{@code calibration-method} - {@code isotonic}, {@code platt} or {@code identity}
 *   <li>{@code calibration-reference} - JSONL reference set used to fit calibration (optional)
 *   <li>{@code worker-threads} - size of the scoring worker pool (default 0, meaning available
 *       processors)
 * </ul>
 *
 * <p>Validated at startup via {@link #validate()}; the application fails to start if values are out
 * of range.
 */
@Configuration
@ConfigurationProperties(prefix = "clinrank.funnel")
public class FunnelProperties {

  private int scoutLimit = FunnelConfig.DEFAULT_K_A;
  private int inspectorLimit = FunnelConfig.DEFAULT_K_B;
  private int judgeLimit = FunnelConfig.DEFAULT_K_C;
  private double lexicalK1 = FunnelConfig.DEFAULT_LEXICAL_K1;
  private double lexicalB = FunnelConfig.DEFAULT_LEXICAL_B;
  private double fusionWeightLexical = 0.5;
  private double fusionWeightDense = 0.5;
  private int candidatesPerMechanism = 0;
  private int evidenceSize = FunnelConfig.DEFAULT_EVIDENCE_SIZE;
  private CalibrationMethod calibrationMethod = CalibrationMethod.ISOTONIC;
  private String calibrationReference = "";
  private int workerThreads = 0;

  /** Validates configuration at startup. Throws if values are out of allowed range. */
  @PostConstruct
  void validate() {
    toConfig();
    if (workerThreads < 0) {
      throw new ConfigurationException(
          "clinrank.funnel.worker-threads must be >= 0, got: " + workerThreads);
    }
  }

  /** Snapshot of the bound values as the immutable configuration passed to the stages. */
  public FunnelConfig toConfig() {
    return new FunnelConfig(
        scoutLimit,
        inspectorLimit,
        judgeLimit,
        lexicalK1,
        lexicalB,
        fusionWeightLexical,
        fusionWeightDense,
        candidatesPerMechanism > 0 ? candidatesPerMechanism : scoutLimit,
        evidenceSize,
        calibrationMethod);
  }

  /** Worker pool size with the processor-count default applied. */
  public int effectiveWorkerThreads() {
    return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
  }

  public int getScoutLimit() {
    return scoutLimit;
  }

  public void setScoutLimit(int scoutLimit) {
    this.scoutLimit = scoutLimit;
  }

  public int getInspectorLimit() {
    return inspectorLimit;
  }

  public void setInspectorLimit(int inspectorLimit) {
    this.inspectorLimit = inspectorLimit;
  }

  public int getJudgeLimit() {
    return judgeLimit;
  }

  public void setJudgeLimit(int judgeLimit) {
    this.judgeLimit = judgeLimit;
  }

  public double getLexicalK1() {
    return lexicalK1;
  }

  public void setLexicalK1(double lexicalK1) {
    this.lexicalK1 = lexicalK1;
  }

  public double getLexicalB() {
    return lexicalB;
  }

  public void setLexicalB(double lexicalB) {
    this.lexicalB = lexicalB;
  }

  public double getFusionWeightLexical() {
    return fusionWeightLexical;
  }

  public void setFusionWeightLexical(double fusionWeightLexical) {
    this.fusionWeightLexical = fusionWeightLexical;
  }

  public double getFusionWeightDense() {
    return fusionWeightDense;
  }

  public void setFusionWeightDense(double fusionWeightDense) {
    this.fusionWeightDense = fusionWeightDense;
  }

  public int getCandidatesPerMechanism() {
    return candidatesPerMechanism;
  }

  public void setCandidatesPerMechanism(int candidatesPerMechanism) {
    this.candidatesPerMechanism = candidatesPerMechanism;
  }

  public int getEvidenceSize() {
    return evidenceSize;
  }

  public void setEvidenceSize(int evidenceSize) {
    this.evidenceSize = evidenceSize;
  }

  public CalibrationMethod getCalibrationMethod() {
    return calibrationMethod;
  }

  public void setCalibrationMethod(CalibrationMethod calibrationMethod) {
    this.calibrationMethod = calibrationMethod;
  }

  public String getCalibrationReference() {
    return calibrationReference;
  }

  public void setCalibrationReference(String calibrationReference) {
    this.calibrationReference = calibrationReference;
  }

  public int getWorkerThreads() {
    return workerThreads;
  }

  public void setWorkerThreads(int workerThreads) {
    this.workerThreads = workerThreads;
  }
}
