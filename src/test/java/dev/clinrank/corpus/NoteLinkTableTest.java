package dev.clinrank.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.clinrank.fixture.ChunkBuilder;
import java.util.List;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.Test;

class NoteLinkTableTest {

  @Test
  void resolves_linked_notes() {
    NoteLinkTable table =
        NoteLinkTable.of(List.of(new NoteLink("n1", "p1"), new NoteLink("n2", "p1")));

    assertThat(table.patientFor("n1")).isEqualTo("p1");
    assertThat(table.patientFor("n2")).isEqualTo("p1");
  }

  @Test
  void unlinked_note_resolves_to_null() {
    assertThat(NoteLinkTable.of(List.of(new NoteLink("n1", "p1"))).patientFor("n2")).isNull();
    assertThat(NoteLinkTable.empty().patientFor("n1")).isNull();
  }

  @Test
  void conflicting_links_keep_the_first() {
    NoteLinkTable table =
        NoteLinkTable.of(List.of(new NoteLink("n1", "p1"), new NoteLink("n1", "p2")));

    assertThat(table.patientFor("n1")).isEqualTo("p1");
    assertThat(table.size()).isEqualTo(1);
  }

  @Test
  void corpus_keeps_first_chunk_per_id_in_file_order() {
    ChunkCorpus corpus =
        ChunkCorpus.of(
            List.of(
                new ChunkBuilder().id("b").text("first b").build(),
                new ChunkBuilder().id("a").build(),
                new ChunkBuilder().id("b").text("second b").build()));

    assertThat(corpus.chunks()).extracting(Chunk::chunkId).containsExactly("b", "a");
    assertThat(corpus.require("b").text()).isEqualTo("first b");
    assertThat(corpus.find("zzz")).isNull();
  }

  @Test
  void requiring_an_unknown_chunk_fails() {
    assertThatThrownBy(() -> ChunkCorpus.empty().require("c1"))
        .isInstanceOf(NoSuchElementException.class)
        .hasMessageContaining("c1");
  }
}
