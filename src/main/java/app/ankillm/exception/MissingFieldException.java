package app.ankillm.exception;

import java.util.Collection;

public class MissingFieldException extends AnkiLlmException {

    public MissingFieldException(String missingKey, Collection<String> expectedKeys) {
        super("Missing field \"" + missingKey + "\" in card. Expected fields: " + String.join(", ", expectedKeys));
    }
}
