package app.ankillm.cli;

/**
 * Bad command line input. The dispatcher prints the message followed by the command's usage.
 */
public class UsageException extends RuntimeException {

    public UsageException(String message) {
        super(message);
    }
}
