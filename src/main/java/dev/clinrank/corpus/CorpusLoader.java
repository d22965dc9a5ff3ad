package dev.clinrank.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Loads the chunk corpus and the note-link table handed over by the upstream canonicalisation and
 * identity-resolution steps.
 *
 * <p>The corpus location may be a single JSONL file or a directory; for a directory every {@code
 * chunks.jsonl} below it is read in path order. A chunk id that was already loaded counts as a
 * skipped line.
 */
@Component
public class CorpusLoader {

  private static final Logger log = LoggerFactory.getLogger(CorpusLoader.class);

  static final String CHUNKS_FILE_NAME = "chunks.jsonl";

  private final JsonLinesReader reader;

  public CorpusLoader(JsonLinesReader reader) {
    this.reader = reader;
  }

  public LoadResult<ChunkCorpus> loadCorpus(Path location) throws IOException {
    List<Path> files = corpusFiles(location);
    List<Chunk> chunks = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    int skipped = 0;

    for (Path file : files) {
      LoadResult<List<Chunk>> result = reader.read(file, Chunk.class);
      skipped += result.skipped();
      for (Chunk chunk : result.value()) {
        if (seen.add(chunk.chunkId())) {
          chunks.add(chunk);
        } else {
          log.warn("Duplicate chunk_id {} in {}; keeping first occurrence", chunk.chunkId(), file);
          skipped++;
        }
      }
    }

    log.info(
        "Loaded {} chunks from {} file(s), {} line(s) skipped",
        chunks.size(),
        files.size(),
        skipped);
    return new LoadResult<>(ChunkCorpus.of(chunks), skipped);
  }

  public LoadResult<NoteLinkTable> loadLinks(Path file) throws IOException {
    LoadResult<List<NoteLink>> result = reader.read(file, NoteLink.class);
    NoteLinkTable table = NoteLinkTable.of(result.value());
    log.info("Loaded {} note links, {} line(s) skipped", table.size(), result.skipped());
    return new LoadResult<>(table, result.skipped());
  }

  private static List<Path> corpusFiles(Path location) throws IOException {
    if (!Files.isDirectory(location)) {
      return List.of(location);
    }
    try (Stream<Path> walk = Files.walk(location)) {
      return walk.filter(Files::isRegularFile)
          .filter(p -> CHUNKS_FILE_NAME.equals(p.getFileName().toString()))
          .sorted()
          .toList();
    }
  }
}
