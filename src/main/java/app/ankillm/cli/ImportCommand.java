package app.ankillm.cli;

import app.ankillm.client.anki.AnkiNote;
import app.ankillm.client.anki.FlashcardStore;
import app.ankillm.client.anki.NoteInfo;
import app.ankillm.exception.AnkiConnectException;
import app.ankillm.exception.DataFileException;
import app.ankillm.generate.DuplicateChecker;
import app.ankillm.io.DataFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a CSV or YAML file into a deck. Rows whose key matches an existing note update that
 * note's fields; all other rows are added as new notes.
 */
@Component
public class ImportCommand implements CliCommand {

    private static final Logger log = LoggerFactory.getLogger(ImportCommand.class);

    static final String IMPORT_TAG = "anki-llm-batch-import";
    static final String DEFAULT_KEY_FIELD = ExportCommand.NOTE_ID_COLUMN;

    private final FlashcardStore store;
    private final DataFileReader dataFileReader;
    private final ConsoleIO console;

    public ImportCommand(FlashcardStore store, DataFileReader dataFileReader, ConsoleIO console) {
        this.store = store;
        this.dataFileReader = dataFileReader;
        this.console = console;
    }

    @Override
    public String name() {
        return "import";
    }

    @Override
    public String description() {
        return "Import a CSV or YAML file into an Anki deck";
    }

    @Override
    public String usage() {
        return """
                Usage: anki-llm import <input> <deck> <note-type> [--key-field=noteId]

                Rows whose key field matches an existing note in the deck update that note.
                Other rows are added as new notes tagged %s.
                With the default key, a file written by `export` updates the notes it came from."""
                .formatted(IMPORT_TAG);
    }

    @Override
    public int run(CommandArguments arguments) {
        String input = arguments.positional(0).orElseThrow(() -> new UsageException("Missing input file"));
        String deck = arguments.positional(1).orElseThrow(() -> new UsageException("Missing deck name"));
        String noteType = arguments.positional(2).orElseThrow(() -> new UsageException("Missing note type"));
        String keyField = arguments.option("key-field").orElse(DEFAULT_KEY_FIELD);
        boolean keyIsNoteId = DEFAULT_KEY_FIELD.equals(keyField);

        console.println("Importing " + input + " into deck '" + deck + "' (note type: " + noteType
                + ", key field: " + keyField + ")");
        DataFileReader.Table table = dataFileReader.readTable(Path.of(input));
        List<Map<String, String>> rows = table.records();
        console.println("Found " + rows.size() + " row(s) in " + input + ".");
        if (rows.isEmpty()) {
            console.println("No rows to import.");
            return 0;
        }
        if (!table.headers().contains(keyField)) {
            throw new DataFileException("Key field \"" + keyField + "\" not found in input file. Available fields: "
                    + String.join(", ", table.headers()));
        }

        List<String> noteTypeFields = store.fieldsForNoteType(noteType);
        List<String> validFields = new ArrayList<>();
        List<String> ignoredFields = new ArrayList<>();
        for (String header : table.headers()) {
            if (header.equals(keyField)) {
                continue;
            }
            if (noteTypeFields.contains(header)) {
                validFields.add(header);
            } else {
                ignoredFields.add(header);
            }
        }
        if (!ignoredFields.isEmpty()) {
            log.warn("Ignoring columns missing from note type noteType={} columns={}", noteType, ignoredFields);
            console.error("Warning: these columns are not fields of '" + noteType + "' and will be ignored: "
                    + String.join(", ", ignoredFields));
        }
        console.println("Fields to import: " + String.join(", ", validFields));

        Map<String, Long> existingByKey = existingNotesByKey(deck, keyField, keyIsNoteId);
        console.println("Found " + existingByKey.size() + " existing note(s) with a '" + keyField + "' key.");

        List<AnkiNote> toAdd = new ArrayList<>();
        Map<Long, Map<String, String>> toUpdate = new LinkedHashMap<>();
        for (Map<String, String> row : rows) {
            Map<String, String> fields = new LinkedHashMap<>();
            for (String field : validFields) {
                fields.put(field, row.getOrDefault(field, ""));
            }
            String key = row.getOrDefault(keyField, "");
            Long existingId = key.isEmpty() ? null : existingByKey.get(key);
            if (existingId != null) {
                toUpdate.put(existingId, fields);
                continue;
            }
            if (!keyIsNoteId && noteTypeFields.contains(keyField)) {
                fields.put(keyField, key);
            }
            toAdd.add(new AnkiNote(deck, noteType, fields, List.of(IMPORT_TAG)));
        }
        console.println(toAdd.size() + " new note(s) to add, " + toUpdate.size() + " existing note(s) to update.");
        log.info("Import partitioned deck={} noteType={} add={} update={}", deck, noteType, toAdd.size(), toUpdate.size());

        int addFailures = addNotes(toAdd);
        int updateFailures = updateNotes(toUpdate);
        console.println("Import finished.");
        return addFailures + updateFailures > 0 ? 1 : 0;
    }

    private Map<String, Long> existingNotesByKey(String deck, String keyField, boolean keyIsNoteId) {
        List<Long> noteIds = store.findNotes("\"deck:" + DuplicateChecker.escapeQueryValue(deck) + "\"");
        Map<String, Long> byKey = new HashMap<>();
        if (noteIds.isEmpty()) {
            return byKey;
        }
        for (NoteInfo note : store.notesInfo(noteIds)) {
            String key = keyIsNoteId ? String.valueOf(note.noteId()) : note.fields().get(keyField);
            if (key != null && !key.isEmpty()) {
                byKey.put(key, note.noteId());
            }
        }
        return byKey;
    }

    private int addNotes(List<AnkiNote> notes) {
        if (notes.isEmpty()) {
            return 0;
        }
        List<Long> ids = store.addNotes(notes);
        long added = ids.stream().filter(Objects::nonNull).count();
        int failed = notes.size() - (int) added;
        console.println("Added " + added + " note(s), " + failed + " failed.");
        if (failed > 0) {
            log.warn("Store rejected notes count={}", failed);
            console.error("Some notes failed to add. Check Anki for possible reasons (e.g. duplicates or empty first field).");
        }
        return failed;
    }

    private int updateNotes(Map<Long, Map<String, String>> updates) {
        int failed = 0;
        for (Map.Entry<Long, Map<String, String>> update : updates.entrySet()) {
            try {
                store.updateNoteFields(update.getKey(), update.getValue());
            } catch (AnkiConnectException ex) {
                failed++;
                log.warn("Note update failed noteId={} message={}", update.getKey(), ex.getMessage());
                console.error("Failed to update note " + update.getKey() + ": " + ex.getMessage());
            }
        }
        if (!updates.isEmpty()) {
            console.println("Updated " + (updates.size() - failed) + " note(s), " + failed + " failed.");
        }
        return failed;
    }
}
