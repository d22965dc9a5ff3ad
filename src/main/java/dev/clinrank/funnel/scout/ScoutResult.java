package dev.clinrank.funnel.scout;

import java.util.List;

/**
 * Scout output with per-mechanism diagnostics.
 *
 * @param candidates at most K_A candidates in canonical order
 * @param lexicalHits hits returned by the lexical index
 * @param denseHits hits returned by the dense index
 * @param lexicalMillis wall time of the lexical search
 * @param denseMillis wall time of the dense search
 * @param fusionMillis wall time of merging, normalising, fusing and ranking
 */
public record ScoutResult(
    List<Candidate> candidates,
    int lexicalHits,
    int denseHits,
    long lexicalMillis,
    long denseMillis,
    long fusionMillis) {

  public ScoutResult {
    candidates = List.copyOf(candidates);
  }
}
