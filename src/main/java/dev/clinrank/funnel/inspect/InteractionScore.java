package dev.clinrank.funnel.inspect;

import java.util.List;

/**
 * Result of a token-level interaction scoring call.
 *
 * @param score interaction score in [0, 1]
 * @param contributions chunk tokens that contributed to the score, any order
 */
public record InteractionScore(double score, List<Evidence> contributions) {

  public InteractionScore {
    contributions = contributions == null ? List.of() : List.copyOf(contributions);
  }
}
