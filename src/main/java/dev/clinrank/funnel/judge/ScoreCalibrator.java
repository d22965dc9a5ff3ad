package dev.clinrank.funnel.judge;

/**
 * Maps a raw pairwise score to a calibrated score in [0, 1]. Implementations must be
 * non-decreasing in their input and thread-safe.
 */
@FunctionalInterface
public interface ScoreCalibrator {

  double calibrate(double rawScore);
}
