package dev.clinrank.funnel.scout;

import static org.assertj.core.api.Assertions.assertThat;

import dev.clinrank.corpus.ChunkCorpus;
import dev.clinrank.fixture.HashingEmbeddingModel;
import dev.clinrank.fixture.SampleCorpus;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EmbeddingStoreDenseIndexTest {

  private final HashingEmbeddingModel model = new HashingEmbeddingModel();
  private final ChunkCorpus corpus = SampleCorpus.corpus();

  @Test
  void in_memory_index_ranks_related_chunks_first() {
    EmbeddingStoreDenseIndex index = EmbeddingStoreDenseIndex.inMemory(model, corpus);

    List<IndexHit> hits = index.search("metformin diabetes", 3);

    assertThat(hits).hasSize(3);
    assertThat(hits.get(0).chunkId()).isEqualTo("c3");
    assertThat(hits).allSatisfy(hit -> assertThat(hit.score()).isBetween(0.0, 1.0));
  }

  @Test
  void index_loads_from_serialized_store(@TempDir Path dir) {
    InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
    store.add("c3", model.embed("diabetes on metformin").content());
    store.add("c5", model.embed("hypertension follow-up").content());
    Path file = dir.resolve("dense-index.json");
    store.serializeToFile(file);

    EmbeddingStoreDenseIndex index = EmbeddingStoreDenseIndex.fromFile(model, file);

    assertThat(index.search("hypertension", 1))
        .extracting(IndexHit::chunkId)
        .containsExactly("c5");
  }
}
