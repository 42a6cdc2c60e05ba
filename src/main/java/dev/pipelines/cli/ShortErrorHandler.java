package dev.pipelines.cli;

import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.NoSuchFileException;

/**
 * Reports a failure of the compile command as a one-line {@code Error:}
 * message. File problems (resource table, output path) exit with the usage
 * code; anything else exits with the command's execution-failure code. The
 * stack trace is shown when {@code -Dpipelines.debug=true} is set.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        commandLine.getErr().println(commandLine.getColorScheme().errorText("Error: " + describe(ex)));
        if (Boolean.getBoolean("pipelines.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        if (ex instanceof IOException) {
            return PipelineCompilerCli.EXIT_SYNTAX;
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String describe(Exception ex) {
        if (ex instanceof NoSuchFileException missing) {
            return "file not found: " + missing.getFile();
        }
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            return ex.getClass().getSimpleName();
        }
        return message;
    }
}
