package dev.clinrank.funnel.judge;

/** How the Judge stage maps raw pairwise scores to calibrated scores. */
public enum CalibrationMethod {
  /** Pool-adjacent-violators isotonic regression with linear interpolation. */
  ISOTONIC,
  /** Platt scaling: a logistic curve fit by Newton's method. */
  PLATT,
  /** No fit; raw scores clamped to [0, 1] and reported as uncalibrated. */
  IDENTITY
}
