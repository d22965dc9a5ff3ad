package dev.clinrank.fixture;

import dev.clinrank.funnel.FunnelConfig;

/**
 * Test builder for {@link FunnelConfig}, starting from {@link FunnelConfig#defaults()}.
 *
 * <p>The per-mechanism fetch size follows K_A.
 *
 * <pre>{@code
 * FunnelConfig config = new FunnelConfigBuilder().limits(3, 2, 1).evidenceSize(0).build();
 * }</pre>
 */
public final class FunnelConfigBuilder {

  private final FunnelConfig defaults = FunnelConfig.defaults();

  private int kA = defaults.kA();
  private int kB = defaults.kB();
  private int kC = defaults.kC();
  private double fusionWeightLexical = defaults.fusionWeightLexical();
  private double fusionWeightDense = defaults.fusionWeightDense();
  private int evidenceSize = defaults.evidenceSize();

  public FunnelConfigBuilder limits(int kA, int kB, int kC) {
    this.kA = kA;
    this.kB = kB;
    this.kC = kC;
    return this;
  }

  public FunnelConfigBuilder fusionWeights(double lexical, double dense) {
    this.fusionWeightLexical = lexical;
    this.fusionWeightDense = dense;
    return this;
  }

  public FunnelConfigBuilder evidenceSize(int evidenceSize) {
    this.evidenceSize = evidenceSize;
    return this;
  }

  public FunnelConfig build() {
    return new FunnelConfig(
        kA,
        kB,
        kC,
        defaults.lexicalK1(),
        defaults.lexicalB(),
        fusionWeightLexical,
        fusionWeightDense,
        kA,
        evidenceSize,
        defaults.calibrationMethod());
  }
}
