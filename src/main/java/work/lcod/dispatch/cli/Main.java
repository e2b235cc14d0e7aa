package work.lcod.dispatch.cli;

import picocli.CommandLine;

/**
 * Entry point for the {@code java -jar} distribution.
 */
public final class Main {
    private Main() {}

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }

    static CommandLine commandLine() {
        return new CommandLine(new DispatchInfoCommand())
            .setExecutionExceptionHandler(new ShortErrorHandler());
    }
}
