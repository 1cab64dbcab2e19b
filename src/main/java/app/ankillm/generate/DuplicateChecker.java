package app.ankillm.generate;

import app.ankillm.client.anki.FlashcardStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Asks the store whether a note with the same first-field value already exists
 * for the note type in the target deck.
 */
@Component
public class DuplicateChecker {

    private static final Logger log = LoggerFactory.getLogger(DuplicateChecker.class);

    private final FlashcardStore store;

    public DuplicateChecker(FlashcardStore store) {
        this.store = store;
    }

    public boolean isDuplicate(String firstFieldValue, String noteType, String deck) {
        if (firstFieldValue == null || firstFieldValue.isBlank()) {
            return false;
        }
        String query = buildQuery(firstFieldValue, noteType, deck);
        try {
            List<Long> noteIds = store.findNotes(query);
            return noteIds != null && !noteIds.isEmpty();
        } catch (RuntimeException ex) {
            log.warn("Could not check for duplicates noteType={} deck={} error={}", noteType, deck, ex.getMessage());
            return false;
        }
    }

    public static String buildQuery(String firstFieldValue, String noteType, String deck) {
        return "\"note:" + escapeQueryValue(noteType) + "\" "
                + "\"deck:" + escapeQueryValue(deck) + "\" "
                + "\"" + escapeQueryValue(firstFieldValue) + "\"";
    }

    /**
     * Escapes characters that the store's search syntax treats specially.
     */
    public static String escapeQueryValue(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\' || ch == '"' || ch == '*' || ch == '_' || ch == ':') {
                escaped.append('\\');
            }
            escaped.append(ch);
        }
        return escaped.toString();
    }
}
