package app.ankillm.exception;

public class StoreMismatchException extends AnkiLlmException {

    public StoreMismatchException(String message) {
        super(message);
    }
}
