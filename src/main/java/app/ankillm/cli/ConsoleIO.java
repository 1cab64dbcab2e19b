package app.ankillm.cli;

import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * User-facing terminal output and prompts. Diagnostics go to the log, not here.
 */
@Component
public class ConsoleIO {

    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;

    public ConsoleIO() {
        this(System.in, System.out, System.err);
    }

    public ConsoleIO(InputStream in, PrintStream out, PrintStream err) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.err = err;
    }

    public void println() {
        out.println();
    }

    public void println(String line) {
        out.println(line);
    }

    public void error(String line) {
        err.println(line);
    }

    /**
     * @return the entered line without surrounding whitespace, or {@code null} at end of input
     */
    public String readLine(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? null : line.trim();
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read from standard input", ex);
        }
    }

    public String ask(String prompt, String defaultValue) {
        String suffix = defaultValue == null || defaultValue.isEmpty() ? ": " : " [" + defaultValue + "]: ";
        String line = readLine(prompt + suffix);
        if (line == null || line.isEmpty()) {
            return defaultValue;
        }
        return line;
    }

    public boolean confirm(String question, boolean defaultValue) {
        while (true) {
            String line = readLine(question + (defaultValue ? " [Y/n] " : " [y/N] "));
            if (line == null || line.isEmpty()) {
                return defaultValue;
            }
            String answer = line.toLowerCase(Locale.ROOT);
            if (answer.equals("y") || answer.equals("yes")) {
                return true;
            }
            if (answer.equals("n") || answer.equals("no")) {
                return false;
            }
            out.println("Please answer y or n.");
        }
    }
}
