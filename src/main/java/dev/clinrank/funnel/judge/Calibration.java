package dev.clinrank.funnel.judge;

import dev.clinrank.funnel.ScoreFusion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits calibration mappings from a reference set and applies them with the monotonicity
 * guarantee the Judge stage relies on.
 *
 * <p>A reference set that cannot support a fit (empty, a single label class, or a Platt fit with
 * non-positive slope) falls back to {@link IdentityCalibrator} and is reported as uncalibrated.
 */
public final class Calibration {

  private static final Logger log = LoggerFactory.getLogger(Calibration.class);

  private Calibration() {}

  /**
   * Fits the requested mapping.
   *
   * @param method calibration method
   * @param reference labelled reference samples; non-finite raw scores are ignored
   * @return the fit, or the identity fallback when the reference set is degenerate
   */
  public static CalibrationFit fit(CalibrationMethod method, List<CalibrationSample> reference) {
    if (method == CalibrationMethod.IDENTITY) {
      return CalibrationFit.identity("identity calibration configured");
    }

    List<CalibrationSample> usable =
        reference.stream().filter(s -> Double.isFinite(s.rawScore())).toList();
    long positives = usable.stream().filter(s -> s.label() == 1).count();
    if (usable.isEmpty()) {
      return degenerate("no calibration reference samples");
    }
    if (positives == 0 || positives == usable.size()) {
      return degenerate("calibration reference has a single label class");
    }

    return switch (method) {
      case ISOTONIC ->
          new CalibrationFit(
              IsotonicCalibrator.fit(usable),
              true,
              "isotonic fit on " + usable.size() + " reference samples");
      case PLATT -> {
        Optional<PlattCalibrator> platt = PlattCalibrator.fit(usable);
        yield platt
            .<CalibrationFit>map(
                p ->
                    new CalibrationFit(
                        p, true, "platt fit on " + usable.size() + " reference samples"))
            .orElseGet(() -> degenerate("platt fit is not increasing in the raw score"));
      }
      case IDENTITY -> CalibrationFit.identity("identity calibration configured");
    };
  }

  /**
   * Applies the calibrator to every raw score and enforces the output contract: each value lies in
   * [0, 1] and a strictly lower raw score never receives a strictly higher calibrated score. The
   * second property is restored with a running maximum over the raw-sorted scores should the
   * mapping violate it.
   *
   * @param calibrator the mapping
   * @param rawScores finite raw scores
   * @return calibrated scores in input order
   */
  public static double[] applyMonotone(ScoreCalibrator calibrator, double[] rawScores) {
    double[] calibrated = new double[rawScores.length];
    for (int i = 0; i < rawScores.length; i++) {
      calibrated[i] = ScoreFusion.clamp(calibrator.calibrate(rawScores[i]));
    }

    List<Integer> byRaw =
        new ArrayList<>(IntStream.range(0, rawScores.length).boxed().toList());
    byRaw.sort(Comparator.comparingDouble(i -> rawScores[i]));

    double runningMax = 0.0;
    int adjusted = 0;
    for (int start = 0; start < byRaw.size(); ) {
      // Equal raw scores form one group and share one output value
      int end = start;
      double groupMax = 0.0;
      while (end < byRaw.size() && rawScores[byRaw.get(end)] == rawScores[byRaw.get(start)]) {
        groupMax = Math.max(groupMax, calibrated[byRaw.get(end)]);
        end++;
      }
      runningMax = Math.max(runningMax, groupMax);
      for (int k = start; k < end; k++) {
        int index = byRaw.get(k);
        if (calibrated[index] != runningMax) {
          calibrated[index] = runningMax;
          adjusted++;
        }
      }
      start = end;
    }

    if (adjusted > 0) {
      log.warn("Calibration mapping was not monotone; adjusted {} score(s)", adjusted);
    }
    return calibrated;
  }

  private static CalibrationFit degenerate(String reason) {
    log.warn("Calibration degenerate ({}); falling back to identity mapping", reason);
    return CalibrationFit.identity(reason);
  }
}
