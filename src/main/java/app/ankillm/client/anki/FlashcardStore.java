package app.ankillm.client.anki;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * The flashcard collection the generated cards end up in.
 * Every operation throws {@link app.ankillm.exception.AnkiConnectException} when the store cannot answer.
 */
public interface FlashcardStore {

    List<String> listDecks();

    List<String> listNoteTypes();

    List<String> fieldsForNoteType(String noteType);

    List<Long> findNotes(String query);

    List<NoteInfo> notesInfo(List<Long> noteIds);

    /**
     * @return one entry per note, {@code null} where the store rejected the note
     */
    List<Long> addNotes(List<AnkiNote> notes);

    /**
     * Overwrites the given fields of one note; fields not named keep their value.
     */
    void updateNoteFields(long noteId, Map<String, String> fields);

    JsonNode invoke(String action, JsonNode params);
}
