package dev.clinrank.funnel.scout;

/**
 * A chunk id with the raw score one retrieval mechanism assigned to it.
 *
 * @param chunkId the matched chunk
 * @param score raw, mechanism-specific score (BM25 value, cosine relevance, ...)
 */
public record IndexHit(String chunkId, double score) {}
