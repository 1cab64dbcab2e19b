package app.ankillm.generate;

import app.ankillm.client.anki.AnkiNote;
import app.ankillm.client.anki.FlashcardStore;
import app.ankillm.domain.PromptTemplate;
import app.ankillm.domain.ValidatedCard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

@Service
public class StoreImporter {

    private static final Logger log = LoggerFactory.getLogger(StoreImporter.class);

    static final String IMPORT_TAG = "anki-llm-generate";

    private final FlashcardStore store;

    public StoreImporter(FlashcardStore store) {
        this.store = store;
    }

    /**
     * Adds cards as notes. Notes the store refuses (usually duplicates) are reported
     * by their first field value.
     */
    public ImportResult importCards(List<ValidatedCard> cards, PromptTemplate template) {
        if (cards.isEmpty()) {
            return new ImportResult(0, List.of());
        }
        List<AnkiNote> notes = cards.stream()
                .map(card -> new AnkiNote(template.deck(), template.noteType(), card.ankiFields(), List.of(IMPORT_TAG)))
                .toList();
        List<Long> ids = store.addNotes(notes);

        int successes = 0;
        List<String> rejected = new ArrayList<>();
        for (int i = 0; i < cards.size(); i++) {
            Long id = i < ids.size() ? ids.get(i) : null;
            if (id != null) {
                successes++;
            } else {
                rejected.add(cards.get(i).ankiFields().values().stream().findFirst().orElse("#" + (i + 1)));
            }
        }
        log.info("Imported notes deck={} noteType={} added={} rejected={}",
                template.deck(), template.noteType(), successes, rejected.size());
        return new ImportResult(successes, rejected);
    }
}
