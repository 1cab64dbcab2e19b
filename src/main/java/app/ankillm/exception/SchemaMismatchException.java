package app.ankillm.exception;

import java.util.Collection;

public class SchemaMismatchException extends AnkiLlmException {

    public SchemaMismatchException(Collection<String> existingFields, Collection<String> newFields) {
        super("Schema mismatch: cannot append cards. Existing file fields: " + String.join(", ", existingFields)
                + ". New card fields: " + String.join(", ", newFields));
    }
}
