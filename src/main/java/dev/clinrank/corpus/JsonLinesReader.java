package dev.clinrank.corpus;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads line-delimited JSON files into validated records.
 *
 * <p>A line that is not valid UTF-8, fails to parse, omits a required field, or parses but
 * violates the record's Bean Validation constraints is skipped and counted; reading continues
 * with the next line. Blank lines are ignored and not counted. I/O failures propagate.
 */
@Component
public class JsonLinesReader {

  private static final Logger log = LoggerFactory.getLogger(JsonLinesReader.class);

  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final ObjectMapper objectMapper;
  private final Validator validator;

  public JsonLinesReader(ObjectMapper objectMapper, Validator validator) {
    this.objectMapper = objectMapper;
    this.validator = validator;
  }

  /**
   * Reads every record in the file.
   *
   * @param path the JSONL file
   * @param type the record type of each line
   * @return the records in file order and the number of skipped lines
   * @throws IOException if the file cannot be read
   */
  public <T> LoadResult<List<T>> read(Path path, Class<T> type) throws IOException {
    ObjectReader lineReader =
        objectMapper
            .readerFor(type)
            .with(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
    CharsetDecoder decoder =
        StandardCharsets.UTF_8
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);

    List<T> records = new ArrayList<>();
    int skipped = 0;
    int lineNumber = 0;

    try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
      ByteArrayOutputStream buffer = new ByteArrayOutputStream();
      byte[] raw;
      while ((raw = nextLine(in, buffer)) != null) {
        lineNumber++;
        String line;
        try {
          line = decoder.decode(ByteBuffer.wrap(raw)).toString();
        } catch (CharacterCodingException e) {
          log.debug("{}:{} is not valid UTF-8", path, lineNumber);
          skipped++;
          continue;
        }
        if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
          line = line.substring(1);
        }
        if (line.isBlank()) {
          continue;
        }
        T parsed = parseLine(path, lineNumber, line, lineReader, type);
        if (parsed == null) {
          skipped++;
        } else {
          records.add(parsed);
        }
      }
    }

    if (skipped > 0) {
      log.warn("Skipped {} malformed {} line(s) in {}", skipped, type.getSimpleName(), path);
    }
    return new LoadResult<>(List.copyOf(records), skipped);
  }

  /** Next line without its terminator ({@code \n} or {@code \r\n}), or null at end of input. */
  private static byte @Nullable [] nextLine(InputStream in, ByteArrayOutputStream buffer)
      throws IOException {
    buffer.reset();
    int next;
    boolean any = false;
    while ((next = in.read()) != -1) {
      any = true;
      if (next == '\n') {
        break;
      }
      buffer.write(next);
    }
    if (!any) {
      return null;
    }
    byte[] line = buffer.toByteArray();
    if (line.length > 0 && line[line.length - 1] == '\r') {
      return Arrays.copyOf(line, line.length - 1);
    }
    return line;
  }

  private <T> @Nullable T parseLine(
      Path path, int lineNumber, String line, ObjectReader lineReader, Class<T> type) {
    T parsed;
    try {
      parsed = lineReader.readValue(line);
    } catch (JsonProcessingException e) {
      log.debug(
          "{}:{} is not a valid {}: {}",
          path,
          lineNumber,
          type.getSimpleName(),
          e.getOriginalMessage());
      return null;
    }
    if (parsed == null) {
      return null;
    }

    Set<ConstraintViolation<T>> violations = validator.validate(parsed);
    if (!violations.isEmpty()) {
      String messages =
          violations.stream()
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .sorted()
              .collect(Collectors.joining(", "));
      log.debug("{}:{} failed validation: {}", path, lineNumber, messages);
      return null;
    }
    return parsed;
  }
}
