package app.ankillm.exception;

public class AnkiConnectException extends AnkiLlmException {

    public AnkiConnectException(String message) {
        super(message);
    }

    public AnkiConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
