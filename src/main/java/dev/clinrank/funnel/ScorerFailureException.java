package dev.clinrank.funnel;

/**
 * A pluggable scorer failed for a candidate. Fatal for the run: the candidate is neither retried
 * nor dropped.
 */
public class ScorerFailureException extends StageException {

  private final int completedCandidates;

  public ScorerFailureException(String stage, int completedCandidates, Throwable cause) {
    super(
        stage,
        "scorer failed after " + completedCandidates + " candidate(s) were scored: "
            + cause.getMessage(),
        cause);
    this.completedCandidates = completedCandidates;
  }

  /** Number of candidates scored successfully before the failure was observed. */
  public int getCompletedCandidates() {
    return completedCandidates;
  }
}
