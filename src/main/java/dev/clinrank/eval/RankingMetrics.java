package dev.clinrank.eval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Standard ranking quality metrics over a ranked list of chunk ids and graded judgments.
 *
 * <p>All methods are pure. A chunk is relevant if its grade is >= 1; unjudged chunks have grade
 * 0. Duplicate judgments for one chunk keep the highest grade.
 */
public final class RankingMetrics {

  private RankingMetrics() {}

  /** Recall@k: fraction of relevant chunks found in the top k. */
  public static double recallAtK(List<String> rankedIds, List<RelevanceGrade> grades, int k) {
    Set<String> relevant = relevantIds(toGradeMap(grades));
    if (relevant.isEmpty()) {
      return 0.0;
    }
    return (double) countRelevant(truncate(rankedIds, k), relevant) / relevant.size();
  }

  /** Precision@k: fraction of the top k that is relevant. */
  public static double precisionAtK(List<String> rankedIds, List<RelevanceGrade> grades, int k) {
    List<String> topK = truncate(rankedIds, k);
    if (topK.isEmpty()) {
      return 0.0;
    }
    return (double) countRelevant(topK, relevantIds(toGradeMap(grades))) / topK.size();
  }

  /** Reciprocal rank of the first relevant chunk within the top k, 0 if there is none. */
  public static double reciprocalRank(List<String> rankedIds, List<RelevanceGrade> grades, int k) {
    Set<String> relevant = relevantIds(toGradeMap(grades));
    List<String> topK = truncate(rankedIds, k);
    for (int i = 0; i < topK.size(); i++) {
      if (relevant.contains(topK.get(i))) {
        return 1.0 / (i + 1);
      }
    }
    return 0.0;
  }

  /** nDCG@k with linear gain. */
  public static double ndcgAtK(List<String> rankedIds, List<RelevanceGrade> grades, int k) {
    Map<String, Integer> gradeMap = toGradeMap(grades);
    List<String> topK = truncate(rankedIds, k);
    double idcg = idcg(gradeMap, k);
    return idcg == 0.0 ? 0.0 : dcg(topK, gradeMap) / idcg;
  }

  /** All four metrics at once. */
  public static MetricsReport compute(List<String> rankedIds, List<RelevanceGrade> grades, int k) {
    return new MetricsReport(
        k,
        rankedIds.size(),
        relevantIds(toGradeMap(grades)).size(),
        recallAtK(rankedIds, grades, k),
        precisionAtK(rankedIds, grades, k),
        reciprocalRank(rankedIds, grades, k),
        ndcgAtK(rankedIds, grades, k));
  }

  private static Map<String, Integer> toGradeMap(List<RelevanceGrade> grades) {
    Map<String, Integer> gradeMap = new HashMap<>();
    for (RelevanceGrade grade : grades) {
      gradeMap.merge(grade.chunkId(), grade.grade(), Math::max);
    }
    return gradeMap;
  }

  private static Set<String> relevantIds(Map<String, Integer> gradeMap) {
    return gradeMap.entrySet().stream()
        .filter(e -> e.getValue() >= 1)
        .map(Map.Entry::getKey)
        .collect(Collectors.toSet());
  }

  private static long countRelevant(List<String> ids, Set<String> relevant) {
    return ids.stream().filter(relevant::contains).count();
  }

  private static List<String> truncate(List<String> ids, int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be positive, got: " + k);
    }
    return ids.subList(0, Math.min(k, ids.size()));
  }

  private static double dcg(List<String> topK, Map<String, Integer> gradeMap) {
    double dcg = 0.0;
    for (int i = 0; i < topK.size(); i++) {
      dcg += gradeMap.getOrDefault(topK.get(i), 0) / log2(i + 2);
    }
    return dcg;
  }

  private static double idcg(Map<String, Integer> gradeMap, int k) {
    List<Integer> sorted = new ArrayList<>(gradeMap.values());
    sorted.sort(Comparator.reverseOrder());
    double idcg = 0.0;
    for (int i = 0; i < Math.min(k, sorted.size()); i++) {
      idcg += sorted.get(i) / log2(i + 2);
    }
    return idcg;
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2);
  }
}
