package dev.clinrank.funnel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;

/**
 * The canonical ranking routine shared by all stages: descending by score, ties broken by
 * ascending id (lexicographic, {@link String#compareTo}).
 *
 * <p>Every stage joins its scored records and passes them through {@link #topK} so that output
 * order depends only on the scores and ids, never on the order in which workers finished.
 */
public final class RankOrdering {

  private RankOrdering() {}

  /** Descending by {@code score}, then ascending by {@code id}. */
  public static <T> Comparator<T> byScoreThenId(
      ToDoubleFunction<T> score, Function<T, String> id) {
    Comparator<T> descendingScore =
        (a, b) -> Double.compare(score.applyAsDouble(b), score.applyAsDouble(a));
    return descendingScore.thenComparing(id);
  }

  /** Descending by {@code primary}, then descending by {@code secondary}, then ascending by id. */
  public static <T> Comparator<T> byScoresThenId(
      ToDoubleFunction<T> primary, ToDoubleFunction<T> secondary, Function<T, String> id) {
    Comparator<T> descendingPrimary =
        (a, b) -> Double.compare(primary.applyAsDouble(b), primary.applyAsDouble(a));
    Comparator<T> descendingSecondary =
        (a, b) -> Double.compare(secondary.applyAsDouble(b), secondary.applyAsDouble(a));
    return descendingPrimary.thenComparing(descendingSecondary).thenComparing(id);
  }

  /**
   * Sorts a copy of the records with the given ordering and keeps the first {@code limit}.
   *
   * @param records records to rank; not modified
   * @param ordering one of the orderings built by this class
   * @param limit maximum number of records to keep (non-negative)
   * @return an immutable ranked list
   */
  public static <T> List<T> topK(Collection<T> records, Comparator<T> ordering, int limit) {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must not be negative, got: " + limit);
    }
    List<T> sorted = new ArrayList<>(records);
    sorted.sort(ordering);
    return List.copyOf(sorted.subList(0, Math.min(limit, sorted.size())));
  }

  /**
   * Drops records whose id was already seen, keeping the first occurrence.
   *
   * @return records with unique ids in input order
   */
  public static <T> List<T> distinctById(List<T> records, Function<T, String> id) {
    Map<String, T> unique = new LinkedHashMap<>();
    for (T record : records) {
      unique.putIfAbsent(id.apply(record), record);
    }
    return List.copyOf(unique.values());
  }
}
