package dev.clinrank.funnel.judge;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class CalibrationTest {

  private static final List<CalibrationSample> REFERENCE =
      List.of(
          new CalibrationSample(0.1, 0),
          new CalibrationSample(0.3, 0),
          new CalibrationSample(0.5, 1),
          new CalibrationSample(0.7, 0),
          new CalibrationSample(0.9, 1));

  @Test
  void isotonic_fit_is_calibrated() {
    CalibrationFit fit = Calibration.fit(CalibrationMethod.ISOTONIC, REFERENCE);

    assertThat(fit.calibrated()).isTrue();
    assertThat(fit.calibrator()).isInstanceOf(IsotonicCalibrator.class);
    assertThat(fit.description()).contains("isotonic").contains("5");
  }

  @Test
  void platt_fit_is_calibrated() {
    CalibrationFit fit = Calibration.fit(CalibrationMethod.PLATT, REFERENCE);

    assertThat(fit.calibrated()).isTrue();
    assertThat(fit.calibrator()).isInstanceOf(PlattCalibrator.class);
  }

  @Test
  void identity_method_is_uncalibrated() {
    CalibrationFit fit = Calibration.fit(CalibrationMethod.IDENTITY, REFERENCE);

    assertThat(fit.calibrated()).isFalse();
    assertThat(fit.calibrator()).isSameAs(IdentityCalibrator.INSTANCE);
  }

  @Test
  void empty_reference_falls_back_to_identity() {
    CalibrationFit fit = Calibration.fit(CalibrationMethod.ISOTONIC, List.of());

    assertThat(fit.calibrated()).isFalse();
    assertThat(fit.calibrator()).isSameAs(IdentityCalibrator.INSTANCE);
  }

  @Test
  void single_label_class_falls_back_to_identity() {
    CalibrationFit fit =
        Calibration.fit(
            CalibrationMethod.PLATT,
            List.of(new CalibrationSample(0.2, 1), new CalibrationSample(0.8, 1)));

    assertThat(fit.calibrated()).isFalse();
    assertThat(fit.description()).contains("single label class");
  }

  @Test
  void decreasing_platt_fit_falls_back_to_identity() {
    CalibrationFit fit =
        Calibration.fit(
            CalibrationMethod.PLATT,
            List.of(
                new CalibrationSample(0.1, 1),
                new CalibrationSample(0.2, 1),
                new CalibrationSample(0.8, 0),
                new CalibrationSample(0.9, 0)));

    assertThat(fit.calibrated()).isFalse();
  }

  @Test
  void identity_fallback_clamps_to_unit_interval() {
    double[] calibrated =
        Calibration.applyMonotone(IdentityCalibrator.INSTANCE, new double[] {-3.0, 0.4, 7.2});

    assertThat(calibrated).containsExactly(0.0, 0.4, 1.0);
  }

  @Test
  void non_monotone_mapping_is_repaired_with_running_maximum() {
    ScoreCalibrator decreasing = raw -> 1.0 - raw;

    double[] calibrated = Calibration.applyMonotone(decreasing, new double[] {0.8, 0.2, 0.5});

    assertThat(calibrated).containsExactly(0.8, 0.8, 0.8);
  }

  @Test
  void equal_raw_scores_share_one_calibrated_score() {
    double[] calibrated =
        Calibration.applyMonotone(raw -> raw * 0.5, new double[] {0.6, 0.6, 0.2});

    assertThat(calibrated[0]).isEqualTo(calibrated[1]);
    assertThat(calibrated[2]).isLessThanOrEqualTo(calibrated[0]);
  }

  @Test
  void monotone_mapping_is_left_unchanged() {
    double[] calibrated =
        Calibration.applyMonotone(raw -> raw * raw, new double[] {0.5, 0.1, 0.9});

    assertThat(calibrated).containsExactly(0.25, 0.1 * 0.1, 0.81);
  }
}
