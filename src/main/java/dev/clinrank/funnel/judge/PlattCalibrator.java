package dev.clinrank.funnel.judge;

import java.util.List;
import java.util.Optional;

/**
 * Platt scaling: {@code p(x) = 1 / (1 + exp(-(a * x + b)))}.
 *
 * <p>Fit by Newton's method with backtracking on the regularised targets of Platt (1999) and Lin
 * et al. (2007): positives target {@code (N+ + 1) / (N+ + 2)}, negatives {@code 1 / (N- + 2)}.
 * A fit whose slope {@code a} is negative would be decreasing and is rejected.
 */
public final class PlattCalibrator implements ScoreCalibrator {

  private static final int MAX_ITERATIONS = 100;
  private static final double MIN_STEP = 1e-10;
  private static final double SIGMA = 1e-12;
  private static final double TOLERANCE = 1e-5;

  private final double a;
  private final double b;

  PlattCalibrator(double a, double b) {
    this.a = a;
    this.b = b;
  }

  /**
   * Fits the logistic curve.
   *
   * @param samples reference samples containing both labels
   * @return the calibrator, or empty when the fitted slope is not positive or not finite
   */
  public static Optional<PlattCalibrator> fit(List<CalibrationSample> samples) {
    int positives = 0;
    for (CalibrationSample sample : samples) {
      positives += sample.label();
    }
    int negatives = samples.size() - positives;
    double highTarget = (positives + 1.0) / (positives + 2.0);
    double lowTarget = 1.0 / (negatives + 2.0);

    int n = samples.size();
    double[] x = new double[n];
    double[] t = new double[n];
    for (int i = 0; i < n; i++) {
      x[i] = samples.get(i).rawScore();
      t[i] = samples.get(i).label() == 1 ? highTarget : lowTarget;
    }

    double slope = 0.0;
    double intercept = Math.log((negatives + 1.0) / (positives + 1.0));
    double objective = objective(x, t, slope, intercept);

    for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
      // Newton step on the negative log-likelihood of p = 1 / (1 + exp(slope * x + intercept))
      double h11 = SIGMA;
      double h22 = SIGMA;
      double h21 = 0.0;
      double g1 = 0.0;
      double g2 = 0.0;
      for (int i = 0; i < n; i++) {
        double f = x[i] * slope + intercept;
        double p;
        double q;
        if (f >= 0) {
          p = Math.exp(-f) / (1.0 + Math.exp(-f));
          q = 1.0 / (1.0 + Math.exp(-f));
        } else {
          p = 1.0 / (1.0 + Math.exp(f));
          q = Math.exp(f) / (1.0 + Math.exp(f));
        }
        double d2 = p * q;
        h11 += x[i] * x[i] * d2;
        h22 += d2;
        h21 += x[i] * d2;
        double d1 = t[i] - p;
        g1 += x[i] * d1;
        g2 += d1;
      }
      if (Math.abs(g1) < TOLERANCE && Math.abs(g2) < TOLERANCE) {
        break;
      }

      double det = h11 * h22 - h21 * h21;
      double dA = -(h22 * g1 - h21 * g2) / det;
      double dB = -(-h21 * g1 + h11 * g2) / det;
      double gd = g1 * dA + g2 * dB;

      double step = 1.0;
      boolean improved = false;
      while (step >= MIN_STEP) {
        double newSlope = slope + step * dA;
        double newIntercept = intercept + step * dB;
        double newObjective = objective(x, t, newSlope, newIntercept);
        if (newObjective < objective + 0.0001 * step * gd) {
          slope = newSlope;
          intercept = newIntercept;
          objective = newObjective;
          improved = true;
          break;
        }
        step /= 2.0;
      }
      if (!improved) {
        break;
      }
    }

    // Internal parameterisation is p = 1 / (1 + exp(slope * x + intercept)); flip signs.
    double a = -slope;
    double b = -intercept;
    if (!Double.isFinite(a) || !Double.isFinite(b) || a <= 0.0) {
      return Optional.empty();
    }
    return Optional.of(new PlattCalibrator(a, b));
  }

  @Override
  public double calibrate(double rawScore) {
    double z = a * rawScore + b;
    if (z >= 0) {
      return 1.0 / (1.0 + Math.exp(-z));
    }
    double e = Math.exp(z);
    return e / (1.0 + e);
  }

  double slope() {
    return a;
  }

  double intercept() {
    return b;
  }

  private static double objective(double[] x, double[] t, double slope, double intercept) {
    double value = 0.0;
    for (int i = 0; i < x.length; i++) {
      double f = x[i] * slope + intercept;
      if (f >= 0) {
        value += t[i] * f + Math.log1p(Math.exp(-f));
      } else {
        value += (t[i] - 1.0) * f + Math.log1p(Math.exp(f));
      }
    }
    return value;
  }
}
