package dev.clinrank.funnel;

import dev.clinrank.funnel.judge.CalibrationMethod;

/**
 * Immutable configuration threaded through every stage of one funnel run.
 *
 * <p>Construction validates the whole configuration and throws {@link ConfigurationException} on
 * the first violation, so a value of this type is always usable.
 *
 * @param kA Scout output limit
 * @param kB Inspector output limit
 * @param kC Judge output limit
 * @param lexicalK1 BM25 term-frequency saturation
 * @param lexicalB BM25 length normalisation, in [0, 1]
 * @param fusionWeightLexical weight of the normalised lexical score in the fusion
 * @param fusionWeightDense weight of the normalised dense score in the fusion
 * @param candidatesPerMechanism hits fetched from each retrieval mechanism before fusion
 * @param evidenceSize evidence tokens kept per rescored candidate; 0 disables evidence
 * @param calibrationMethod how Judge maps raw pairwise scores to calibrated scores
 */
public record FunnelConfig(
    int kA,
    int kB,
    int kC,
    double lexicalK1,
    double lexicalB,
    double fusionWeightLexical,
    double fusionWeightDense,
    int candidatesPerMechanism,
    int evidenceSize,
    CalibrationMethod calibrationMethod) {

  public static final int DEFAULT_K_A = 200;
  public static final int DEFAULT_K_B = 50;
  public static final int DEFAULT_K_C = 10;
  public static final double DEFAULT_LEXICAL_K1 = 0.9;
  public static final double DEFAULT_LEXICAL_B = 0.4;
  public static final int DEFAULT_EVIDENCE_SIZE = 10;

  public FunnelConfig {
    if (kA < 1 || kB < 1 || kC < 1) {
      throw new ConfigurationException(
          "K_A, K_B and K_C must be positive, got K_A=%d, K_B=%d, K_C=%d".formatted(kA, kB, kC));
    }
    if (kA < kB || kB < kC) {
      throw new ConfigurationException(
          "Limits must satisfy K_A >= K_B >= K_C, got K_A=%d, K_B=%d, K_C=%d"
              .formatted(kA, kB, kC));
    }
    if (!Double.isFinite(lexicalK1) || lexicalK1 < 0.0) {
      throw new ConfigurationException("lexical_k1 must be >= 0, got: " + lexicalK1);
    }
    if (!Double.isFinite(lexicalB) || lexicalB < 0.0 || lexicalB > 1.0) {
      throw new ConfigurationException("lexical_b must be in [0.0, 1.0], got: " + lexicalB);
    }
    ScoreFusion.requireValidWeights(fusionWeightLexical, fusionWeightDense);
    if (candidatesPerMechanism < 1) {
      throw new ConfigurationException(
          "candidates per mechanism must be positive, got: " + candidatesPerMechanism);
    }
    if (evidenceSize < 0) {
      throw new ConfigurationException("evidence size must be >= 0, got: " + evidenceSize);
    }
    if (calibrationMethod == null) {
      throw new ConfigurationException("calibration method must be set");
    }
  }

  /** Defaults: K 200/50/10, BM25 k1=0.9 b=0.4, equal fusion weights, isotonic calibration. */
  public static FunnelConfig defaults() {
    return new FunnelConfig(
        DEFAULT_K_A,
        DEFAULT_K_B,
        DEFAULT_K_C,
        DEFAULT_LEXICAL_K1,
        DEFAULT_LEXICAL_B,
        0.5,
        0.5,
        DEFAULT_K_A,
        DEFAULT_EVIDENCE_SIZE,
        CalibrationMethod.ISOTONIC);
  }
}
