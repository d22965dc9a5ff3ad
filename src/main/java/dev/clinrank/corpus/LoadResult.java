package dev.clinrank.corpus;

/**
 * Value loaded from a line-delimited JSON source together with the number of lines that were
 * skipped because they did not match the expected record shape.
 *
 * @param value the loaded value
 * @param skipped number of skipped lines (never negative)
 * @param <T> type of the loaded value
 */
public record LoadResult<T>(T value, int skipped) {

  public LoadResult {
    if (skipped < 0) {
      throw new IllegalArgumentException("skipped must not be negative");
    }
  }
}
