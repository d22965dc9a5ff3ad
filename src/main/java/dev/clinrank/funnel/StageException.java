package dev.clinrank.funnel;

/** A funnel stage could not complete. Carries the stage name for user-facing reporting. */
public class StageException extends RuntimeException {

  private final String stage;

  public StageException(String stage, String message) {
    super(stage + ": " + message);
    this.stage = stage;
  }

  public StageException(String stage, String message, Throwable cause) {
    super(stage + ": " + message, cause);
    this.stage = stage;
  }

  public String getStage() {
    return stage;
  }
}
