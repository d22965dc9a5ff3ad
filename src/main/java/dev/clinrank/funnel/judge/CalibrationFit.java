package dev.clinrank.funnel.judge;

/**
 * A fitted calibration mapping and whether it is a real calibration or the identity fallback.
 *
 * @param calibrator the mapping to apply
 * @param calibrated false when the identity fallback is in use
 * @param description human-readable note for stage summaries and logs
 */
public record CalibrationFit(ScoreCalibrator calibrator, boolean calibrated, String description) {

  /** The uncalibrated identity fallback with the reason it was chosen. */
  public static CalibrationFit identity(String reason) {
    return new CalibrationFit(IdentityCalibrator.INSTANCE, false, reason);
  }
}
