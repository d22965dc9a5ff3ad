package dev.clinrank.corpus;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.springframework.stereotype.Component;

/** Writes records as line-delimited JSON, one compact object per line, in list order. */
@Component
public class JsonLinesWriter {

  private final ObjectMapper objectMapper;

  public JsonLinesWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Writes the records, replacing any existing file. Parent directories are created.
   *
   * @param path the target file
   * @param records records to write
   * @throws IOException if writing fails
   */
  public void write(Path path, List<?> records) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    ObjectWriter writer = objectMapper.writer();
    try (BufferedWriter out = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      for (Object record : records) {
        out.write(writer.writeValueAsString(record));
        out.write('\n');
      }
    }
  }
}
