package dev.clinrank.funnel;

import java.util.Arrays;

/**
 * Pure static utility for score normalisation and weighted fusion shared by the funnel stages.
 *
 * <p>Min-max normalisation maps each raw score to {@code (raw - min) / (max - min)}. When every
 * score in the set is identical ({@code max == min}, which covers single-element and all-zero
 * sets) every member normalises to 1.0 rather than failing or demoting a uniform set.
 *
 * <p>Fusion is the weighted sum {@code wLexical * lexical + wDense * dense}; the weights must sum
 * to 1.0 within {@link #WEIGHT_EPSILON}.
 */
public final class ScoreFusion {

  /** Tolerance for the fusion weight sum. */
  public static final double WEIGHT_EPSILON = 1e-6;

  private ScoreFusion() {}

  /**
   * Min-max normalises the scores to [0, 1].
   *
   * @param rawScores raw scores; must be finite
   * @return a new array of normalised scores, same order as the input
   * @throws IllegalArgumentException if a score is NaN or infinite
   */
  public static double[] normalise(double[] rawScores) {
    if (rawScores.length == 0) {
      return new double[0];
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double score : rawScores) {
      if (!Double.isFinite(score)) {
        throw new IllegalArgumentException("Cannot normalise non-finite score: " + score);
      }
      min = Math.min(min, score);
      max = Math.max(max, score);
    }

    double[] normalised = new double[rawScores.length];
    if (max == min) {
      Arrays.fill(normalised, 1.0);
      return normalised;
    }
    double range = max - min;
    for (int i = 0; i < rawScores.length; i++) {
      normalised[i] = clamp((rawScores[i] - min) / range);
    }
    return normalised;
  }

  /**
   * Weighted sum of two normalised scores, clamped to [0, 1] against rounding drift.
   *
   * @param lexical normalised lexical score
   * @param dense normalised dense score
   * @param weightLexical lexical weight
   * @param weightDense dense weight
   * @return the fused score
   */
  public static double fuse(
      double lexical, double dense, double weightLexical, double weightDense) {
    return clamp(weightLexical * lexical + weightDense * dense);
  }

  /**
   * Checks that both weights are finite, non-negative and sum to 1.0 within {@link
   * #WEIGHT_EPSILON}.
   *
   * @throws ConfigurationException otherwise
   */
  public static void requireValidWeights(double weightLexical, double weightDense) {
    if (!Double.isFinite(weightLexical)
        || !Double.isFinite(weightDense)
        || weightLexical < 0.0
        || weightDense < 0.0) {
      throw new ConfigurationException(
          "Fusion weights must be finite and non-negative, got lexical=%s, dense=%s"
              .formatted(weightLexical, weightDense));
    }
    if (Math.abs(weightLexical + weightDense - 1.0) > WEIGHT_EPSILON) {
      throw new ConfigurationException(
          "Fusion weights must sum to 1.0, got lexical=%s + dense=%s = %s"
              .formatted(weightLexical, weightDense, weightLexical + weightDense));
    }
  }

  /** Clamps a score to [0, 1]. */
  public static double clamp(double score) {
    return Math.max(0.0, Math.min(1.0, score));
  }
}
