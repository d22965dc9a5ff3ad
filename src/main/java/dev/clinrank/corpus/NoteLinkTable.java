package dev.clinrank.corpus;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lookup from note id to patient id built from the identity-resolution link table.
 *
 * <p>A note without a link is an unknown patient, never an error.
 */
public final class NoteLinkTable {

  private static final Logger log = LoggerFactory.getLogger(NoteLinkTable.class);

  private static final NoteLinkTable EMPTY = new NoteLinkTable(Map.of());

  private final Map<String, String> patientByNote;

  private NoteLinkTable(Map<String, String> patientByNote) {
    this.patientByNote = patientByNote;
  }

  /**
   * Builds the lookup. When a note is linked more than once the first link is kept and the
   * conflict is logged.
   *
   * @param links links in file order
   * @return an immutable lookup table
   */
  public static NoteLinkTable of(List<NoteLink> links) {
    Map<String, String> byNote = new HashMap<>();
    for (NoteLink link : links) {
      String existing = byNote.putIfAbsent(link.noteUid(), link.patientUid());
      if (existing != null && !existing.equals(link.patientUid())) {
        log.warn(
            "Note {} linked to both {} and {}; keeping {}",
            link.noteUid(),
            existing,
            link.patientUid(),
            existing);
      }
    }
    return new NoteLinkTable(Collections.unmodifiableMap(byNote));
  }

  public static NoteLinkTable empty() {
    return EMPTY;
  }

  /** Returns the patient linked to the note, or null when the note is not linked. */
  public @Nullable String patientFor(String noteUid) {
    return patientByNote.get(noteUid);
  }

  public int size() {
    return patientByNote.size();
  }
}
