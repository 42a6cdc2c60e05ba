package dev.pipelines;

import dev.pipelines.cli.PipelineCompilerCli;

public class Main {
    public static void main(String[] args) {
        int exitCode = PipelineCompilerCli.commandLine().execute(args);
        System.exit(exitCode);
    }
}
