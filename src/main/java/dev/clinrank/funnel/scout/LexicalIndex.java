package dev.clinrank.funnel.scout;

import java.util.List;

/** Read-only lexical retrieval over the corpus: query in, raw-scored chunk ids out. */
public interface LexicalIndex {

  /**
   * Returns the best lexical matches for the query.
   *
   * @param query free-text query
   * @param maxResults maximum number of hits
   * @return hits with raw scores, best first; empty when nothing matches
   */
  List<IndexHit> search(String query, int maxResults);
}
