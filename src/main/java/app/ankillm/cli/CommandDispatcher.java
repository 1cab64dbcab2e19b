package app.ankillm.cli;

import app.ankillm.exception.AnkiLlmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Picks the command named by the first positional argument and records its exit code.
 */
@Component
public class CommandDispatcher implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    static final String HELP = "help";

    private final Map<String, CliCommand> commands = new LinkedHashMap<>();
    private final ConsoleIO console;
    private int exitCode;

    public CommandDispatcher(List<CliCommand> commands, ConsoleIO console) {
        commands.forEach(command -> this.commands.put(command.name(), command));
        this.console = console;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> nonOptions = args.getNonOptionArgs();
        String name = nonOptions.isEmpty() ? HELP : nonOptions.get(0);
        if (HELP.equals(name) || args.containsOption(HELP)) {
            printHelp(nonOptions.size() > 1 ? nonOptions.get(1) : null);
            exitCode = 0;
            return;
        }

        CliCommand command = commands.get(name);
        if (command == null) {
            console.error("Unknown command: " + name);
            printHelp(null);
            exitCode = 1;
            return;
        }

        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put("runId", runId);
        try {
            log.info("Command started command={} runId={}", name, runId);
            exitCode = command.run(new CommandArguments(args, runId));
            log.info("Command finished command={} exitCode={}", name, exitCode);
        } catch (UsageException ex) {
            console.error("Error: " + ex.getMessage());
            console.println();
            console.println(command.usage());
            exitCode = 1;
        } catch (AnkiLlmException ex) {
            log.warn("Command failed command={} errorType={} message={}", name, ex.getClass().getSimpleName(), ex.getMessage());
            console.error("Error: " + ex.getMessage());
            exitCode = 1;
        } catch (RuntimeException ex) {
            log.error("Command failed command={}", name, ex);
            console.error("Error: " + ex.getMessage());
            exitCode = 1;
        } finally {
            MDC.remove("runId");
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void printHelp(String topic) {
        CliCommand command = topic == null ? null : commands.get(topic);
        if (command != null) {
            console.println(command.description());
            console.println();
            console.println(command.usage());
            return;
        }
        console.println("anki-llm: generate Anki flashcards with a language model");
        console.println();
        console.println("Usage: anki-llm <command> [options]");
        console.println();
        console.println("Commands:");
        for (CliCommand each : commands.values()) {
            console.println(String.format("  %-10s %s", each.name(), each.description()));
        }
        console.println(String.format("  %-10s %s", HELP, "Show this help, or help for one command"));
    }
}
