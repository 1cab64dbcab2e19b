package app.ankillm.cli;

import app.ankillm.client.anki.FlashcardStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

/**
 * Sends one raw AnkiConnect action and prints the result as JSON.
 */
@Component
public class QueryCommand implements CliCommand {

    private final FlashcardStore store;
    private final ObjectMapper objectMapper;
    private final ConsoleIO console;

    public QueryCommand(FlashcardStore store, ObjectMapper objectMapper, ConsoleIO console) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.console = console;
    }

    @Override
    public String name() {
        return "query";
    }

    @Override
    public String description() {
        return "Run an AnkiConnect action and print the JSON result";
    }

    @Override
    public String usage() {
        return """
                Usage: anki-llm query <action> [json params]

                Examples:
                  anki-llm query deckNames
                  anki-llm query findNotes '{"query":"deck:Japanese"}'
                  anki-llm query getDeckStats '{"decks":["Default"]}'""";
    }

    @Override
    public int run(CommandArguments arguments) {
        String action = arguments.positional(0)
                .orElseThrow(() -> new UsageException("Missing AnkiConnect action"));
        JsonNode params = arguments.positional(1).map(this::parseParams).orElse(null);

        JsonNode result = store.invoke(action, params);
        try {
            console.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to print result: " + ex.getOriginalMessage(), ex);
        }
        return 0;
    }

    private JsonNode parseParams(String raw) {
        JsonNode params;
        try {
            params = objectMapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            throw new UsageException("Invalid JSON in params argument: " + ex.getOriginalMessage()
                    + ". Example: '{\"query\":\"deck:Default\"}'");
        }
        if (params == null || !params.isObject()) {
            throw new UsageException("Params must be a JSON object. Example: '{\"query\":\"deck:Default\"}'");
        }
        return params;
    }
}
