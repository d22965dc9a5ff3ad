package dev.clinrank.funnel;

import org.springframework.boot.ExitCodeGenerator;

/**
 * Thrown when the funnel configuration is invalid: non-positive or mis-ordered limits, fusion
 * weights that do not sum to 1.0, or out-of-range lexical parameters. Always raised before any
 * stage runs.
 *
 * <p>When it aborts application startup the process exits with {@link #EXIT_CODE}.
 */
public class ConfigurationException extends IllegalStateException implements ExitCodeGenerator {

  public static final int EXIT_CODE = 2;

  public ConfigurationException(String message) {
    super(message);
  }

  @Override
  public int getExitCode() {
    return EXIT_CODE;
  }
}
