package dev.clinrank.funnel.judge;

import dev.clinrank.funnel.TextTokens;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.output.Response;
import dev.langchain4j.model.scoring.ScoringModel;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Deterministic pairwise relevance scorer used when no cross-encoder model is configured.
 *
 * <p>The score combines three signals over the distinct query terms, each in [0, 1]:
 *
 * <ul>
 *   <li>coverage (weight 0.6) - fraction of query terms present in the passage
 *   <li>proximity (weight 0.3) - matched term count divided by the length of the shortest passage
 *       window containing every matched term
 *   <li>order (weight 0.1) - fraction of adjacent query term pairs that also appear adjacent and in
 *       order in the passage
 * </ul>
 */
public class TermCoverageScoringModel implements ScoringModel {

  static final double COVERAGE_WEIGHT = 0.6;
  static final double PROXIMITY_WEIGHT = 0.3;
  static final double ORDER_WEIGHT = 0.1;

  @Override
  public Response<List<Double>> scoreAll(List<TextSegment> segments, String query) {
    List<String> queryTerms = new ArrayList<>(new LinkedHashSet<>(TextTokens.tokenize(query)));
    List<Double> scores = new ArrayList<>(segments.size());
    for (TextSegment segment : segments) {
      scores.add(score(queryTerms, TextTokens.tokenize(segment.text())));
    }
    return Response.from(scores);
  }

  static double score(List<String> queryTerms, List<String> passage) {
    if (queryTerms.isEmpty() || passage.isEmpty()) {
      return 0.0;
    }

    Map<String, Integer> termIndex = new HashMap<>();
    for (int i = 0; i < queryTerms.size(); i++) {
      termIndex.put(queryTerms.get(i), i);
    }

    boolean[] present = new boolean[queryTerms.size()];
    List<int[]> occurrences = new ArrayList<>();
    for (int position = 0; position < passage.size(); position++) {
      Integer term = termIndex.get(passage.get(position));
      if (term != null) {
        present[term] = true;
        occurrences.add(new int[] {position, term});
      }
    }

    int matched = 0;
    for (boolean p : present) {
      if (p) {
        matched++;
      }
    }
    if (matched == 0) {
      return 0.0;
    }

    double coverage = (double) matched / queryTerms.size();
    double proximity = (double) matched / shortestWindow(occurrences, queryTerms.size(), matched);
    double order = orderedPairs(queryTerms, passage);
    return COVERAGE_WEIGHT * coverage + PROXIMITY_WEIGHT * proximity + ORDER_WEIGHT * order;
  }

  /** Length in tokens of the shortest window holding every matched term at least once. */
  private static int shortestWindow(List<int[]> occurrences, int termCount, int matched) {
    int[] counts = new int[termCount];
    int covered = 0;
    int best = Integer.MAX_VALUE;
    int left = 0;
    for (int right = 0; right < occurrences.size(); right++) {
      if (counts[occurrences.get(right)[1]]++ == 0) {
        covered++;
      }
      while (covered == matched) {
        int width = occurrences.get(right)[0] - occurrences.get(left)[0] + 1;
        best = Math.min(best, width);
        if (--counts[occurrences.get(left)[1]] == 0) {
          covered--;
        }
        left++;
      }
    }
    return best;
  }

  private static double orderedPairs(List<String> queryTerms, List<String> passage) {
    if (queryTerms.size() < 2) {
      return 0.0;
    }
    int found = 0;
    for (int i = 0; i + 1 < queryTerms.size(); i++) {
      String first = queryTerms.get(i);
      String second = queryTerms.get(i + 1);
      for (int p = 0; p + 1 < passage.size(); p++) {
        if (first.equals(passage.get(p)) && second.equals(passage.get(p + 1))) {
          found++;
          break;
        }
      }
    }
    return (double) found / (queryTerms.size() - 1);
  }
}
