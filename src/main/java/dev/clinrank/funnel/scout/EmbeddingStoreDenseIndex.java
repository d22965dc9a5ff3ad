package dev.clinrank.funnel.scout;

import dev.clinrank.corpus.Chunk;
import dev.clinrank.corpus.ChunkCorpus;
import dev.langchain4j.data.document.Metadata;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStore;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dense retrieval backed by a LangChain4j {@link EmbeddingStore}.
 *
 * <p>Stored embedding ids are chunk ids. The query is embedded with the same {@link
 * EmbeddingModel} that produced the stored vectors and the store's relevance score is returned as
 * the raw dense score.
 */
public final class EmbeddingStoreDenseIndex implements DenseIndex {

  private static final Logger log = LoggerFactory.getLogger(EmbeddingStoreDenseIndex.class);

  static final int EMBED_BATCH_SIZE = 256;

  static final String SOURCE_NOTE_ID = "source_note_id";

  private final EmbeddingModel embeddingModel;
  private final EmbeddingStore<TextSegment> embeddingStore;

  public EmbeddingStoreDenseIndex(
      EmbeddingModel embeddingModel, EmbeddingStore<TextSegment> embeddingStore) {
    this.embeddingModel = embeddingModel;
    this.embeddingStore = embeddingStore;
  }

  /**
   * Opens a serialized {@link InMemoryEmbeddingStore} whose embedding ids are chunk ids.
   *
   * @param embeddingModel the model the stored vectors were built with
   * @param storeFile the serialized store
   * @return the dense index
   */
  public static EmbeddingStoreDenseIndex fromFile(EmbeddingModel embeddingModel, Path storeFile) {
    log.info("Opening dense index {}", storeFile);
    return new EmbeddingStoreDenseIndex(embeddingModel, InMemoryEmbeddingStore.fromFile(storeFile));
  }

  /**
   * Embeds every chunk of the corpus into a fresh in-memory store, in batches.
   *
   * @param embeddingModel the embedding model
   * @param corpus the corpus snapshot
   * @return the dense index
   */
  public static EmbeddingStoreDenseIndex inMemory(
      EmbeddingModel embeddingModel, ChunkCorpus corpus) {
    InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
    List<Chunk> chunks = new ArrayList<>(corpus.chunks());

    for (int start = 0; start < chunks.size(); start += EMBED_BATCH_SIZE) {
      List<Chunk> batch = chunks.subList(start, Math.min(start + EMBED_BATCH_SIZE, chunks.size()));
      List<TextSegment> segments =
          batch.stream().map(EmbeddingStoreDenseIndex::toSegment).toList();
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
      for (int i = 0; i < batch.size(); i++) {
        store.add(batch.get(i).chunkId(), embeddings.get(i), segments.get(i));
      }
    }

    log.debug("Embedded {} chunks into in-memory dense index", chunks.size());
    return new EmbeddingStoreDenseIndex(embeddingModel, store);
  }

  @Override
  public List<IndexHit> search(String query, int maxResults) {
    Embedding queryEmbedding = embeddingModel.embed(query).content();
    EmbeddingSearchRequest request =
        EmbeddingSearchRequest.builder()
            .queryEmbedding(queryEmbedding)
            .maxResults(maxResults)
            .minScore(0.0)
            .build();

    List<EmbeddingMatch<TextSegment>> matches = embeddingStore.search(request).matches();
    return matches.stream().map(m -> new IndexHit(m.embeddingId(), m.score())).toList();
  }

  private static TextSegment toSegment(Chunk chunk) {
    return TextSegment.from(chunk.text(), Metadata.from(SOURCE_NOTE_ID, chunk.sourceNoteId()));
  }
}
