package dev.clinrank.funnel.inspect;

/**
 * Token-level interaction signal between a query and one chunk text, used by the Inspector
 * stage. Implementations must be thread-safe and return a score in [0, 1].
 */
public interface InteractionScorer {

  InteractionScore score(String query, String chunkText);
}
