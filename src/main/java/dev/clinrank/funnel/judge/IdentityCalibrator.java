package dev.clinrank.funnel.judge;

import dev.clinrank.funnel.ScoreFusion;

/** Fallback mapping: the raw score itself, clamped to [0, 1]. */
public final class IdentityCalibrator implements ScoreCalibrator {

  public static final IdentityCalibrator INSTANCE = new IdentityCalibrator();

  private IdentityCalibrator() {}

  @Override
  public double calibrate(double rawScore) {
    return ScoreFusion.clamp(rawScore);
  }
}
