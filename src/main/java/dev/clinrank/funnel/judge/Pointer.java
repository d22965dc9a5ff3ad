package dev.clinrank.funnel.judge;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Location of a ranked chunk in its source note.
 *
 * @param sourceNoteId the note
 * @param offset character offset of the chunk in the note
 */
@JsonPropertyOrder({"source_note_id", "offset"})
public record Pointer(
    @NotBlank @JsonProperty("source_note_id") String sourceNoteId,
    @PositiveOrZero @JsonProperty(value = "offset", required = true) long offset) {}
