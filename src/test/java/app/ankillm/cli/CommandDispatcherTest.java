package app.ankillm.cli;

import app.ankillm.config.UserConfigProps;
import app.ankillm.config.UserConfigStore;
import app.ankillm.exception.AnkiConnectException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class CommandDispatcherTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        ConsoleIO console = new ConsoleIO(new ByteArrayInputStream(new byte[0]),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
        UserConfigStore store = new UserConfigStore(new UserConfigProps(tempDir.toString()), new ObjectMapper());
        CliCommand failing = new CliCommand() {
            @Override
            public String name() {
                return "query";
            }

            @Override
            public String description() {
                return "Fails";
            }

            @Override
            public String usage() {
                return "Usage: query";
            }

            @Override
            public int run(CommandArguments arguments) {
                throw new AnkiConnectException("Could not connect to AnkiConnect");
            }
        };
        dispatcher = new CommandDispatcher(List.of(new ConfigCommand(store, console), failing), console);
    }

    @Test
    void noCommandPrintsHelp() {
        dispatcher.run(new DefaultApplicationArguments());

        assertEquals(0, dispatcher.getExitCode());
        assertThat(stdout()).contains("Usage: anki-llm <command>").contains("config").contains("query");
    }

    @Test
    void configSetThenGet() {
        dispatcher.run(new DefaultApplicationArguments("config", "set", "model", "gpt-4o"));
        assertEquals(0, dispatcher.getExitCode());

        dispatcher.run(new DefaultApplicationArguments("config", "get", "model"));

        assertEquals(0, dispatcher.getExitCode());
        assertThat(stdout()).endsWith("gpt-4o\n");
    }

    @Test
    void getOfUnsetKeyFails() {
        dispatcher.run(new DefaultApplicationArguments("config", "get", "model"));

        assertEquals(1, dispatcher.getExitCode());
        assertThat(stderr()).contains("\"model\" is not set");
    }

    @Test
    void usageErrorPrintsCommandUsage() {
        dispatcher.run(new DefaultApplicationArguments("config", "set", "model"));

        assertEquals(1, dispatcher.getExitCode());
        assertThat(stderr()).contains("requires a key and a value");
        assertThat(stdout()).contains("Usage: anki-llm config");
    }

    @Test
    void unknownCommandFails() {
        dispatcher.run(new DefaultApplicationArguments("frobnicate"));

        assertEquals(1, dispatcher.getExitCode());
        assertThat(stderr()).contains("Unknown command: frobnicate");
    }

    @Test
    void domainErrorIsReportedWithExitCodeOne() {
        dispatcher.run(new DefaultApplicationArguments("query", "deckNames"));

        assertEquals(1, dispatcher.getExitCode());
        assertThat(stderr()).contains("Error: Could not connect to AnkiConnect");
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
