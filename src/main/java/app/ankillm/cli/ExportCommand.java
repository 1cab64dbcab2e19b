package app.ankillm.cli;

import app.ankillm.client.anki.FlashcardStore;
import app.ankillm.client.anki.NoteInfo;
import app.ankillm.exception.DataFileException;
import app.ankillm.generate.DuplicateChecker;
import app.ankillm.io.CardFileExporter;
import app.ankillm.io.DataFileFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Dumps every note of a deck to CSV or YAML. Rows carry the note id so the file can be
 * fed back as generation input.
 */
@Component
public class ExportCommand implements CliCommand {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    static final String NOTE_ID_COLUMN = "noteId";
    private static final String DEFAULT_EXTENSION = ".yaml";

    private final FlashcardStore store;
    private final CardFileExporter exporter;
    private final ConsoleIO console;

    public ExportCommand(FlashcardStore store, CardFileExporter exporter, ConsoleIO console) {
        this.store = store;
        this.exporter = exporter;
        this.console = console;
    }

    @Override
    public String name() {
        return "export";
    }

    @Override
    public String description() {
        return "Export an Anki deck to CSV or YAML";
    }

    @Override
    public String usage() {
        return """
                Usage: anki-llm export <deck> [output]

                Without output the file is named after the deck (e.g. "My Deck" -> my-deck.yaml).
                An output of just ".csv" or ".yml" keeps the generated name with that extension.""";
    }

    @Override
    public int run(CommandArguments arguments) {
        String deck = arguments.positional(0).orElseThrow(() -> new UsageException("Missing deck name"));
        Path output = resolveOutputPath(deck, arguments.positional(1).orElse(null));

        List<Long> noteIds = store.findNotes("\"deck:" + DuplicateChecker.escapeQueryValue(deck) + "\"");
        console.println("Found " + noteIds.size() + " note(s) in '" + deck + "'.");
        if (noteIds.isEmpty()) {
            console.println("No notes found to export.");
            return 0;
        }

        List<NoteInfo> notes = store.notesInfo(noteIds);
        if (notes.isEmpty()) {
            console.error("Error: could not read the notes of deck " + deck);
            return 1;
        }
        String modelName = notes.get(0).modelName();
        List<String> fieldNames = store.fieldsForNoteType(modelName);
        console.println("Note type: " + modelName + " (fields: " + String.join(", ", fieldNames) + ")");

        List<String> headers = new ArrayList<>();
        headers.add(NOTE_ID_COLUMN);
        headers.addAll(fieldNames);
        List<Map<String, String>> records = new ArrayList<>(notes.size());
        for (NoteInfo note : notes) {
            if (!modelName.equals(note.modelName())) {
                log.warn("Deck mixes note types deck={} expected={} noteId={} modelName={}",
                        deck, modelName, note.noteId(), note.modelName());
            }
            Map<String, String> record = new LinkedHashMap<>();
            record.put(NOTE_ID_COLUMN, String.valueOf(note.noteId()));
            for (String field : fieldNames) {
                record.put(field, note.fields().getOrDefault(field, "").replace("\r", ""));
            }
            records.add(record);
        }

        exporter.writeRecords(records, headers, output);
        console.println("Exported " + records.size() + " note(s) to " + output);
        console.println("To apply edits: anki-llm import " + output + " \"" + deck + "\" \"" + modelName + "\"");
        return 0;
    }

    static Path resolveOutputPath(String deck, String output) {
        if (output == null || output.isBlank()) {
            return Path.of(slugify(deck) + DEFAULT_EXTENSION);
        }
        if (output.startsWith(".")) {
            if (!List.of(".csv", ".yaml", ".yml").contains(output)) {
                throw new DataFileException("Unsupported file extension: '" + output + "'. Use .csv, .yaml, or .yml");
            }
            return Path.of(slugify(deck) + output);
        }
        Path path = Path.of(output);
        DataFileFormat.fromPath(path);
        return path;
    }

    /**
     * File-safe name from the last {@code ::} part of a deck name.
     */
    static String slugify(String deck) {
        String[] parts = deck.split("::");
        return parts[parts.length - 1].toLowerCase(Locale.ROOT).trim()
                .replaceAll("[^a-z0-9\\s-]", "")
                .replaceAll("[\\s-]+", "-")
                .replaceAll("^-+|-+$", "");
    }
}
