package app.ankillm.exception;

public class AnkiLlmException extends RuntimeException {

    public AnkiLlmException(String message) {
        super(message);
    }

    public AnkiLlmException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether a row-level attempt that failed with this error may be retried.
     */
    public boolean isRetryable() {
        return false;
    }
}
