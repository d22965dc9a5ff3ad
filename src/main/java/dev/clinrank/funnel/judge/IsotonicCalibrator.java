package dev.clinrank.funnel.judge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Isotonic regression fit by pool-adjacent-violators.
 *
 * <p>Samples are sorted by raw score, equal raw scores are merged into one weighted point, and
 * adjacent blocks whose means decrease are pooled until the sequence is non-decreasing. Between
 * fitted points the mapping interpolates linearly; outside the reference range it is flat at the
 * end values. The result is non-decreasing and stays within [0, 1] because labels are 0 or 1.
 */
public final class IsotonicCalibrator implements ScoreCalibrator {

  private final double[] xs;
  private final double[] ys;

  private IsotonicCalibrator(double[] xs, double[] ys) {
    this.xs = xs;
    this.ys = ys;
  }

  /**
   * Fits the mapping.
   *
   * @param samples reference samples; must not be empty
   * @return the fitted calibrator
   */
  public static IsotonicCalibrator fit(List<CalibrationSample> samples) {
    if (samples.isEmpty()) {
      throw new IllegalArgumentException("Isotonic fit needs at least one sample");
    }
    List<CalibrationSample> sorted = new ArrayList<>(samples);
    sorted.sort(Comparator.comparingDouble(CalibrationSample::rawScore));

    // Merge equal raw scores into weighted points
    List<Block> blocks = new ArrayList<>();
    for (CalibrationSample sample : sorted) {
      Block last = blocks.isEmpty() ? null : blocks.get(blocks.size() - 1);
      if (last != null && last.maxX == sample.rawScore()) {
        last.add(sample.label(), 1.0);
      } else {
        blocks.add(new Block(sample.rawScore(), sample.label()));
      }
    }
    int points = blocks.size();
    double[] xs = new double[points];
    for (int i = 0; i < points; i++) {
      xs[i] = blocks.get(i).minX;
    }

    // Pool adjacent violators
    List<Block> stack = new ArrayList<>();
    for (Block block : blocks) {
      Block current = block;
      while (!stack.isEmpty() && stack.get(stack.size() - 1).mean() > current.mean()) {
        Block previous = stack.remove(stack.size() - 1);
        previous.absorb(current);
        current = previous;
      }
      stack.add(current);
    }

    double[] ys = new double[points];
    int index = 0;
    for (Block block : stack) {
      Arrays.fill(ys, index, index + block.points, block.mean());
      index += block.points;
    }
    return new IsotonicCalibrator(xs, ys);
  }

  @Override
  public double calibrate(double rawScore) {
    if (Double.isNaN(rawScore)) {
      throw new IllegalArgumentException("Cannot calibrate NaN");
    }
    if (rawScore <= xs[0]) {
      return ys[0];
    }
    int last = xs.length - 1;
    if (rawScore >= xs[last]) {
      return ys[last];
    }
    int position = Arrays.binarySearch(xs, rawScore);
    if (position >= 0) {
      return ys[position];
    }
    int upper = -position - 1;
    int lower = upper - 1;
    double fraction = (rawScore - xs[lower]) / (xs[upper] - xs[lower]);
    return ys[lower] + fraction * (ys[upper] - ys[lower]);
  }

  private static final class Block {
    private final double minX;
    private double maxX;
    private double labelSum;
    private double weight;
    private int points;

    Block(double x, int label) {
      this.minX = x;
      this.maxX = x;
      this.labelSum = label;
      this.weight = 1.0;
      this.points = 1;
    }

    void add(int label, double sampleWeight) {
      labelSum += label * sampleWeight;
      weight += sampleWeight;
    }

    void absorb(Block next) {
      labelSum += next.labelSum;
      weight += next.weight;
      points += next.points;
      maxX = next.maxX;
    }

    double mean() {
      return labelSum / weight;
    }
  }
}
