package dev.clinrank.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * A canonical text chunk cut from a clinical note. One line of the corpus JSONL file.
 *
 * @param chunkId globally unique chunk identifier
 * @param sourceNoteId identifier of the note the chunk was cut from
 * @param text the chunk text
 * @param offset character offset of the chunk within its source note
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Chunk(
    @NotBlank @JsonProperty("chunk_id") String chunkId,
    @NotBlank @JsonProperty("source_note_id") String sourceNoteId,
    @NotBlank @JsonProperty("text") String text,
    @NotNull @PositiveOrZero @JsonProperty("offset") Long offset) {}
