package dev.clinrank.funnel.scout;

import java.util.List;

/** Read-only dense (vector) retrieval over the corpus: query in, raw-scored chunk ids out. */
public interface DenseIndex {

  /**
   * Returns the nearest chunks to the query embedding.
   *
   * @param query free-text query
   * @param maxResults maximum number of hits
   * @return hits with raw similarity scores, best first
   */
  List<IndexHit> search(String query, int maxResults);
}
