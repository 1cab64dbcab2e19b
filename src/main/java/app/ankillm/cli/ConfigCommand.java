package app.ankillm.cli;

import app.ankillm.config.UserConfigStore;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class ConfigCommand implements CliCommand {

    private final UserConfigStore store;
    private final ConsoleIO console;

    public ConfigCommand(UserConfigStore store, ConsoleIO console) {
        this.store = store;
        this.console = console;
    }

    @Override
    public String name() {
        return "config";
    }

    @Override
    public String description() {
        return "Read or change persistent settings such as the default model";
    }

    @Override
    public String usage() {
        return """
                Usage: anki-llm config <get|set|unset|list> [key] [value]

                Examples:
                  anki-llm config set model gpt-4o-mini
                  anki-llm config get model
                  anki-llm config list""";
    }

    @Override
    public int run(CommandArguments arguments) {
        String action = arguments.positional(0).orElse("list");
        switch (action) {
            case "get" -> {
                String key = requireKey(arguments, action);
                return store.get(key).map(value -> {
                    console.println(value);
                    return 0;
                }).orElseGet(() -> {
                    console.error("\"" + key + "\" is not set");
                    return 1;
                });
            }
            case "set" -> {
                String key = requireKey(arguments, action);
                String value = arguments.positional(2)
                        .orElseThrow(() -> new UsageException("The \"set\" action requires a key and a value."));
                store.set(key, value);
                console.println("Set \"" + key + "\" to \"" + value + "\"");
                return 0;
            }
            case "unset" -> {
                String key = requireKey(arguments, action);
                if (store.unset(key)) {
                    console.println("Removed \"" + key + "\"");
                } else {
                    console.println("\"" + key + "\" was not set");
                }
                return 0;
            }
            case "list" -> {
                Map<String, String> values = store.list();
                if (values.isEmpty()) {
                    console.println("No configuration set (" + store.path() + ")");
                } else {
                    values.forEach((key, value) -> console.println(key + " = " + value));
                }
                return 0;
            }
            default -> throw new UsageException("Unknown config action: " + action);
        }
    }

    private String requireKey(CommandArguments arguments, String action) {
        return arguments.positional(1)
                .orElseThrow(() -> new UsageException("The \"" + action + "\" action requires a key."));
    }
}
