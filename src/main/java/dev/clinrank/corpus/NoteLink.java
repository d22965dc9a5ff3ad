package dev.clinrank.corpus;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * One resolved note-to-patient link produced by identity resolution.
 *
 * @param noteUid the note identifier, matched against {@link Chunk#sourceNoteId()}
 * @param patientUid the resolved patient identifier
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record NoteLink(
    @NotBlank @JsonProperty("note_uid") String noteUid,
    @NotBlank @JsonProperty("patient_uid") String patientUid) {}
