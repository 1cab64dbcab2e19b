package app.ankillm.exception;

public class DataFileException extends AnkiLlmException {

    public DataFileException(String message) {
        super(message);
    }

    public DataFileException(String message, Throwable cause) {
        super(message, cause);
    }
}
