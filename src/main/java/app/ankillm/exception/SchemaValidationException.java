package app.ankillm.exception;

import java.util.List;

public class SchemaValidationException extends AnkiLlmException {

    private final List<String> problems;

    public SchemaValidationException(List<String> problems) {
        super("Response does not match the card schema: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
