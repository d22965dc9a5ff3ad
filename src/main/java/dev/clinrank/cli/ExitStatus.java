package dev.clinrank.cli;

import dev.clinrank.funnel.ConfigurationException;

/** Process exit codes of the command line. */
public enum ExitStatus {
  OK(0),
  UNEXPECTED(1),
  USAGE(ConfigurationException.EXIT_CODE),
  IO_ERROR(3),
  SCORER_FAILURE(4);

  private final int code;

  ExitStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
