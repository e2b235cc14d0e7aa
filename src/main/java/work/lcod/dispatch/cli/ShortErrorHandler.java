package work.lcod.dispatch.cli;

import picocli.CommandLine;
import work.lcod.dispatch.errors.DispatchException;

/**
 * Keeps CLI failures short: one line with the dispatch error code, when any exception in the
 * cause chain carries one, and the root cause when it says something new.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final String DEBUG_PROPERTY = "graph.dispatch.debug";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText(summarize(ex)));
        if (Boolean.getBoolean(DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String summarize(Throwable failure) {
        DispatchException dispatch = null;
        Throwable root = failure;
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (dispatch == null && current instanceof DispatchException found) {
                dispatch = found;
            }
            root = current;
        }
        Throwable headline = dispatch != null ? dispatch : failure;
        String message = describe(headline);
        if (root != headline) {
            String rootMessage = describe(root);
            if (!message.contains(rootMessage)) {
                message = message + ": " + rootMessage;
            }
        }
        return dispatch != null ? "[" + dispatch.code() + "] " + message : message;
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        return message == null || message.isBlank() ? failure.getClass().getSimpleName() : message;
    }
}
