package app.ankillm.exception;

public class TemplateException extends AnkiLlmException {

    public TemplateException(String message) {
        super(message);
    }
}
