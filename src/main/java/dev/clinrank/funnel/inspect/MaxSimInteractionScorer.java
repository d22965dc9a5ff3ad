package dev.clinrank.funnel.inspect;

import dev.clinrank.funnel.TextTokens;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Late-interaction scorer in the MaxSim style: every distinct query token is matched against its
 * most similar chunk token and the interaction score is the mean of those maxima.
 *
 * <p>Token similarity is 1.0 for an exact match, otherwise the Dice coefficient of the two
 * tokens' character bigrams when both have at least {@link #MIN_PARTIAL_LENGTH} characters and
 * the coefficient reaches {@link #MIN_PARTIAL_SIMILARITY}; anything else is 0. The chunk token
 * that wins a query token (first position on ties) receives that query token's share of the score
 * as its contribution.
 */
public class MaxSimInteractionScorer implements InteractionScorer {

  static final int MIN_PARTIAL_LENGTH = 4;
  static final double MIN_PARTIAL_SIMILARITY = 0.5;

  @Override
  public InteractionScore score(String query, String chunkText) {
    List<String> queryTokens = new ArrayList<>(new LinkedHashSet<>(TextTokens.tokenize(query)));
    List<String> chunkTokens = TextTokens.tokenize(chunkText);
    if (queryTokens.isEmpty() || chunkTokens.isEmpty()) {
      return new InteractionScore(0.0, List.of());
    }

    Map<String, Set<String>> bigramCache = new LinkedHashMap<>();
    Map<Integer, Double> contributionByPosition = new LinkedHashMap<>();
    double share = 1.0 / queryTokens.size();
    double total = 0.0;

    for (String queryToken : queryTokens) {
      double best = 0.0;
      int bestPosition = -1;
      for (int position = 0; position < chunkTokens.size(); position++) {
        double similarity = similarity(queryToken, chunkTokens.get(position), bigramCache);
        if (similarity > best) {
          best = similarity;
          bestPosition = position;
          if (best == 1.0) {
            break;
          }
        }
      }
      if (bestPosition >= 0) {
        total += best * share;
        contributionByPosition.merge(bestPosition, best * share, Double::sum);
      }
    }

    List<Evidence> contributions = new ArrayList<>(contributionByPosition.size());
    contributionByPosition.forEach(
        (position, weight) ->
            contributions.add(new Evidence(chunkTokens.get(position), weight, position)));
    return new InteractionScore(Math.min(1.0, total), contributions);
  }

  static double similarity(String a, String b, Map<String, Set<String>> bigramCache) {
    if (a.equals(b)) {
      return 1.0;
    }
    if (a.length() < MIN_PARTIAL_LENGTH || b.length() < MIN_PARTIAL_LENGTH) {
      return 0.0;
    }
    Set<String> bigramsA = bigramCache.computeIfAbsent(a, MaxSimInteractionScorer::bigrams);
    Set<String> bigramsB = bigramCache.computeIfAbsent(b, MaxSimInteractionScorer::bigrams);
    int shared = 0;
    for (String bigram : bigramsA) {
      if (bigramsB.contains(bigram)) {
        shared++;
      }
    }
    double dice = 2.0 * shared / (bigramsA.size() + bigramsB.size());
    return dice >= MIN_PARTIAL_SIMILARITY ? dice : 0.0;
  }

  private static Set<String> bigrams(String token) {
    Set<String> bigrams = new HashSet<>();
    for (int i = 0; i + 2 <= token.length(); i++) {
      bigrams.add(token.substring(i, i + 2));
    }
    return bigrams;
  }
}
