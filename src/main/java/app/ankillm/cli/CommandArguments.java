package app.ankillm.cli;

import org.springframework.boot.ApplicationArguments;

import java.util.List;
import java.util.Optional;

/**
 * Options ({@code --name=value} or {@code --flag}) and positional arguments of one command.
 * The command name itself is not a positional.
 */
public class CommandArguments {

    private final ApplicationArguments args;
    private final String runId;

    public CommandArguments(ApplicationArguments args, String runId) {
        this.args = args;
        this.runId = runId;
    }

    public String runId() {
        return runId;
    }

    public List<String> positionals() {
        List<String> nonOptions = args.getNonOptionArgs();
        return nonOptions.isEmpty() ? List.of() : nonOptions.subList(1, nonOptions.size());
    }

    public Optional<String> positional(int index) {
        List<String> positionals = positionals();
        return index < positionals.size() ? Optional.of(positionals.get(index)) : Optional.empty();
    }

    public Optional<String> option(String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null) {
            return Optional.empty();
        }
        if (values.isEmpty() || values.get(values.size() - 1).isBlank()) {
            throw new UsageException("Option --" + name + " requires a value");
        }
        return Optional.of(values.get(values.size() - 1).trim());
    }

    public String requiredOption(String name) {
        return option(name).orElseThrow(() -> new UsageException("Missing required option --" + name));
    }

    public boolean flag(String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        List<String> values = args.getOptionValues(name);
        return values.isEmpty() || !"false".equalsIgnoreCase(values.get(values.size() - 1));
    }

    public Optional<Integer> intOption(String name) {
        return option(name).map(value -> {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException ex) {
                throw new UsageException("Option --" + name + " must be an integer, got: " + value);
            }
        });
    }

    public Optional<Long> longOption(String name) {
        return option(name).map(value -> {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException ex) {
                throw new UsageException("Option --" + name + " must be an integer, got: " + value);
            }
        });
    }

    public Optional<Double> doubleOption(String name) {
        return option(name).map(value -> {
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException ex) {
                throw new UsageException("Option --" + name + " must be a number, got: " + value);
            }
        });
    }
}
