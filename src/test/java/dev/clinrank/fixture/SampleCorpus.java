package dev.clinrank.fixture;

import dev.clinrank.corpus.Chunk;
import dev.clinrank.corpus.ChunkCorpus;
import java.util.List;

/** A small corpus of clinical note chunks shared by stage and pipeline tests. */
public final class SampleCorpus {

  private SampleCorpus() {}

  public static List<Chunk> chunks() {
    return List.of(
        new ChunkBuilder()
            .id("c1")
            .note("note-a")
            .offset(0)
            .text("Patient presents with chest pain radiating to the left arm.")
            .build(),
        new ChunkBuilder()
            .id("c2")
            .note("note-a")
            .offset(61)
            .text("ECG shows ST elevation; chest pain resolved after nitroglycerin.")
            .build(),
        new ChunkBuilder()
            .id("c3")
            .note("note-b")
            .offset(0)
            .text("Type 2 diabetes mellitus, well controlled on metformin.")
            .build(),
        new ChunkBuilder()
            .id("c4")
            .note("note-c")
            .offset(12)
            .text("Denies shortness of breath. No history of cardiac disease.")
            .build(),
        new ChunkBuilder()
            .id("c5")
            .note("note-d")
            .offset(0)
            .text("Follow-up for hypertension; blood pressure 150/95.")
            .build());
  }

  public static ChunkCorpus corpus() {
    return ChunkCorpus.of(chunks());
  }
}
