package app.ankillm.cli;

import app.ankillm.client.anki.FlashcardStore;
import app.ankillm.domain.PromptTemplate;
import app.ankillm.io.PromptFileWriter;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Interactively builds a prompt file for a deck and note type that exist in Anki.
 */
@Component
public class InitCommand implements CliCommand {

    private static final Map<String, String> COMMON_KEYS = Map.ofEntries(
            Map.entry("english", "en"),
            Map.entry("japanese", "jp"),
            Map.entry("furigana", "furigana"),
            Map.entry("romaji", "rom"),
            Map.entry("context", "context"),
            Map.entry("notes", "note"),
            Map.entry("translation", "translation"),
            Map.entry("front", "front"),
            Map.entry("back", "back"),
            Map.entry("example", "example"),
            Map.entry("meaning", "meaning")
    );

    private final FlashcardStore store;
    private final PromptFileWriter promptFileWriter;
    private final ConsoleIO console;

    public InitCommand(FlashcardStore store, PromptFileWriter promptFileWriter, ConsoleIO console) {
        this.store = store;
        this.promptFileWriter = promptFileWriter;
        this.console = console;
    }

    @Override
    public String name() {
        return "init";
    }

    @Override
    public String description() {
        return "Create a prompt file interactively";
    }

    @Override
    public String usage() {
        return "Usage: anki-llm init [--output=<file>]   (default: prompt.md)";
    }

    @Override
    public int run(CommandArguments arguments) {
        Path output = Path.of(arguments.option("output").orElse("prompt.md"));
        if (Files.exists(output) && !console.confirm(output + " already exists. Overwrite?", false)) {
            console.println("Cancelled.");
            return 0;
        }

        String deck = choose("Deck", store.listDecks());
        String noteType = choose("Note type", store.listNoteTypes());
        List<String> fields = store.fieldsForNoteType(noteType);

        console.println();
        console.println("Choose the JSON key the model should use for each field.");
        Map<String, String> fieldMap = new LinkedHashMap<>();
        Set<String> usedKeys = new LinkedHashSet<>();
        for (String field : fields) {
            String key = console.ask("  Key for \"" + field + "\"", suggestKey(field));
            while (key == null || key.isBlank() || !usedKeys.add(key)) {
                console.println("  Keys must be non-empty and unique.");
                key = console.ask("  Key for \"" + field + "\"", null);
                if (key == null) {
                    return 1;
                }
            }
            fieldMap.put(key, field);
        }

        PromptTemplate template = new PromptTemplate(deck, noteType, fieldMap, null, promptBody(fieldMap));
        promptFileWriter.write(template, output);
        console.println();
        console.println("Wrote " + output);
        console.println("Edit the prompt body, then run: anki-llm generate --prompt=" + output + " --input=<rows.csv>");
        return 0;
    }

    private String choose(String label, List<String> options) {
        if (options.isEmpty()) {
            throw new UsageException("Anki has no " + label.toLowerCase(Locale.ROOT) + " to choose from");
        }
        console.println();
        for (int i = 0; i < options.size(); i++) {
            console.println(String.format("  %2d. %s", i + 1, options.get(i)));
        }
        while (true) {
            String answer = console.ask(label + " (number or name)", options.get(0));
            if (answer == null) {
                throw new UsageException("No " + label.toLowerCase(Locale.ROOT) + " chosen");
            }
            if (options.contains(answer)) {
                return answer;
            }
            if (answer.matches("\\d{1,6}")) {
                int number = Integer.parseInt(answer);
                if (number >= 1 && number <= options.size()) {
                    return options.get(number - 1);
                }
            }
            console.println("  Unknown " + label.toLowerCase(Locale.ROOT) + ": " + answer);
        }
    }

    static String suggestKey(String fieldName) {
        String lower = fieldName.toLowerCase(Locale.ROOT);
        String common = COMMON_KEYS.get(lower);
        if (common != null) {
            return common;
        }
        if (fieldName.length() <= 3) {
            return lower;
        }
        return fieldName.length() <= 6 ? lower.substring(0, 3) : lower.substring(0, 4);
    }

    static String promptBody(Map<String, String> fieldMap) {
        StringBuilder example = new StringBuilder("{\n");
        int i = 0;
        for (String key : fieldMap.keySet()) {
            example.append("  \"").append(key).append("\": \"Example value for ").append(key).append('"');
            example.append(++i < fieldMap.size() ? ",\n" : "\n");
        }
        example.append('}');
        return """
                You are an expert assistant who creates one excellent Anki flashcard for a vocabulary term.
                The term to create a card for is: **{term}**

                IMPORTANT: Your output must be a single, valid JSON object and nothing else.
                Do not include any explanation, markdown formatting, or additional text.
                All field values must be strings.
                For fields that require formatting (like lists or emphasis), generate a single string containing well-formed HTML.

                Follow the structure and HTML formatting shown in this example precisely:

                ```json
                %s
                ```

                Return only valid JSON matching this structure.""".formatted(example);
    }
}
