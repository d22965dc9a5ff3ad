package dev.clinrank.corpus;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.jspecify.annotations.Nullable;

/**
 * Read-only snapshot of the chunk corpus keyed by chunk id.
 *
 * <p>Instances are immutable and safe to share across scoring workers.
 */
public final class ChunkCorpus {

  private static final ChunkCorpus EMPTY = new ChunkCorpus(Map.of());

  private final Map<String, Chunk> chunksById;

  private ChunkCorpus(Map<String, Chunk> chunksById) {
    this.chunksById = chunksById;
  }

  /**
   * Builds a corpus from chunks in file order. The first chunk wins when an id repeats.
   *
   * @param chunks the chunks to index
   * @return an immutable corpus
   */
  public static ChunkCorpus of(List<Chunk> chunks) {
    Map<String, Chunk> byId = new LinkedHashMap<>();
    for (Chunk chunk : chunks) {
      byId.putIfAbsent(chunk.chunkId(), chunk);
    }
    return new ChunkCorpus(Collections.unmodifiableMap(byId));
  }

  public static ChunkCorpus empty() {
    return EMPTY;
  }

  public @Nullable Chunk find(String chunkId) {
    return chunksById.get(chunkId);
  }

  /**
   * Returns the chunk with the given id.
   *
   * @throws NoSuchElementException if the corpus has no such chunk
   */
  public Chunk require(String chunkId) {
    Chunk chunk = chunksById.get(chunkId);
    if (chunk == null) {
      throw new NoSuchElementException("Chunk not found in corpus: " + chunkId);
    }
    return chunk;
  }

  public boolean contains(String chunkId) {
    return chunksById.containsKey(chunkId);
  }

  /** Chunks in corpus file order. */
  public Collection<Chunk> chunks() {
    return chunksById.values();
  }

  public int size() {
    return chunksById.size();
  }
}
