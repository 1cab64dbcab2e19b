package app.ankillm.generate;

import app.ankillm.client.anki.FlashcardStore;
import app.ankillm.domain.PromptTemplate;
import app.ankillm.exception.AnkiConnectException;
import app.ankillm.exception.StoreMismatchException;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class StoreAssetValidator {

    private final FlashcardStore store;

    public StoreAssetValidator(FlashcardStore store) {
        this.store = store;
    }

    /**
     * Checks deck, note type and field map against the store.
     *
     * @return the note type's fields in store order; the first one is the unique field
     */
    public List<String> validate(PromptTemplate template) {
        List<String> decks = store.listDecks();
        if (!decks.contains(template.deck())) {
            throw new StoreMismatchException("Deck \"" + template.deck() + "\" does not exist in Anki. Available decks: "
                    + String.join(", ", decks));
        }

        List<String> noteTypes = store.listNoteTypes();
        if (!noteTypes.contains(template.noteType())) {
            throw new StoreMismatchException("Note type \"" + template.noteType()
                    + "\" does not exist. Available note types: " + String.join(", ", noteTypes));
        }

        List<String> noteTypeFields;
        try {
            noteTypeFields = store.fieldsForNoteType(template.noteType());
        } catch (AnkiConnectException ex) {
            throw new StoreMismatchException("Could not read fields of note type \"" + template.noteType() + "\": "
                    + ex.getMessage());
        }
        if (noteTypeFields == null || noteTypeFields.isEmpty()) {
            throw new StoreMismatchException("Note type \"" + template.noteType() + "\" has no fields");
        }

        List<String> invalid = template.fieldMap().values().stream()
                .filter(field -> !noteTypeFields.contains(field))
                .toList();
        if (!invalid.isEmpty()) {
            throw new StoreMismatchException("The following fields from your fieldMap do not exist in note type \""
                    + template.noteType() + "\": " + String.join(", ", invalid)
                    + ". Available fields: " + String.join(", ", noteTypeFields));
        }
        return List.copyOf(noteTypeFields);
    }
}
