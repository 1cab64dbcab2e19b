package app.ankillm.cli;

public interface CliCommand {

    String name();

    String description();

    String usage();

    /**
     * @return process exit code, 0 on success
     */
    int run(CommandArguments arguments);
}
