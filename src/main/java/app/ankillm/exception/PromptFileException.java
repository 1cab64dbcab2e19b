package app.ankillm.exception;

public class PromptFileException extends AnkiLlmException {

    public PromptFileException(String message) {
        super(message);
    }

    public PromptFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
