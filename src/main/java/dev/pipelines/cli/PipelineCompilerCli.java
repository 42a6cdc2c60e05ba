package dev.pipelines.cli;

import ch.qos.logback.classic.Level;
import dev.pipelines.engine.GraphValidator;
import dev.pipelines.engine.PipelineCompiler;
import dev.pipelines.engine.PipelineParser;
import dev.pipelines.engine.PipelineSyntaxException;
import dev.pipelines.model.CompilationResult;
import dev.pipelines.model.PipelineLimits;
import dev.pipelines.model.PipelineNode;
import dev.pipelines.model.ResourceKind;
import dev.pipelines.model.ValidationResult;
import dev.pipelines.project.ResourceScanner;
import dev.pipelines.project.ResourceTableLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI entry point: compiles an operator expression into a workflow module.
 */
@Command(
    name = "pipelinec",
    mixinStandardHelpOptions = true,
    version = "pipelinec 0.1.0",
    description = "Compile an operator expression (→ sequence, ⇄ parallel, →? conditional) into a workflow."
)
public class PipelineCompilerCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_SYNTAX = 2;

    private static final Logger log = LoggerFactory.getLogger(PipelineCompilerCli.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Operator expression, e.g. \"Fetch → Process ⇄ Store\"")
    private String expression;

    @Option(names = {"-n", "--name"}, description = "Pipeline workflow class name")
    private String pipelineName;

    @Option(names = {"-p", "--project"}, description = "Project package name (default: detected under --scan)")
    private String projectName;

    @Option(names = "--resources", description = "JSON resource table (name → kind)")
    private Path resourcesFile;

    @Option(names = "--scan", defaultValue = ".", description = "Project root to scan for resources (default: current directory)")
    private Path projectRoot;

    @Option(names = "--strict", description = "Treat warnings as errors")
    private boolean strict;

    @Option(names = "--check", description = "Validate only, do not generate code")
    private boolean checkOnly;

    @Option(names = "--graph", description = "Print execution order and dependencies, then exit")
    private boolean graph;

    @Option(names = {"-o", "--output"}, description = "Write generated source to this file instead of stdout")
    private Path output;

    @Option(names = "--report", defaultValue = "TEXT", description = "Report format: ${COMPLETION-CANDIDATES}")
    private ReportFormat reportFormat;

    @Option(names = "--max-depth", description = "Override nesting depth warning threshold")
    private Integer maxDepth;

    @Option(names = "--max-resources", description = "Override resource count warning threshold")
    private Integer maxResources;

    @Option(names = "--max-parallel", description = "Override parallel section warning threshold")
    private Integer maxParallel;

    @Option(names = "--max-conditionals", description = "Override conditional branch warning threshold")
    private Integer maxConditionals;

    @Option(names = {"-v", "--verbose"}, description = "Log compiler stages")
    private boolean verbose;

    /** Command line with the error handler installed, as used by {@code Main}. */
    public static CommandLine commandLine() {
        return new CommandLine(new PipelineCompilerCli())
            .setExecutionExceptionHandler(new ShortErrorHandler())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() throws IOException {
        if (verbose) {
            var logger = (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("dev.pipelines");
            logger.setLevel(Level.DEBUG);
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            if (graph) {
                return printGraph(out);
            }

            var compiler = new PipelineCompiler(loadResources(), limits(), strict);
            if (checkOnly) {
                ValidationResult result = compiler.check(expression);
                out.print(ValidationReport.render(result, reportFormat));
                return result.valid() ? EXIT_OK : EXIT_INVALID;
            }
            return compile(compiler, out, err);
        } catch (PipelineSyntaxException e) {
            printSyntaxError(err, e);
            return EXIT_SYNTAX;
        }
    }

    private int compile(PipelineCompiler compiler, PrintWriter out, PrintWriter err) throws IOException {
        if (pipelineName == null || pipelineName.isBlank()) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Missing required option: --name");
        }
        String project = resolveProjectName();

        CompilationResult result = compiler.compile(expression, pipelineName, project);
        if (result instanceof CompilationResult.Rejected rejected) {
            var report = new ValidationResult(false, rejected.errors(), rejected.warnings(), null);
            err.print(ValidationReport.render(report, reportFormat));
            return EXIT_INVALID;
        }

        var compiled = (CompilationResult.Compiled) result;
        for (String warning : compiled.validation().warnings()) {
            err.println("Warning: " + warning);
        }
        if (output == null) {
            out.print(compiled.source());
        } else {
            if (output.getParent() != null) {
                Files.createDirectories(output.getParent());
            }
            Files.writeString(output, compiled.source(), StandardCharsets.UTF_8);
            out.println("Generated pipeline " + pipelineName + ": " + output);
        }
        return EXIT_OK;
    }

    private int printGraph(PrintWriter out) {
        PipelineNode root = PipelineParser.parse(expression);
        var validator = new GraphValidator(root);
        out.println("Structure: " + root.describe());
        out.print(ValidationReport.graph(validator.executionOrder(), validator.dependencies()));
        return EXIT_OK;
    }

    private Map<String, ResourceKind> loadResources() throws IOException {
        if (resourcesFile != null) {
            log.debug("Loading resource table from {}", resourcesFile);
            return ResourceTableLoader.loadFromFile(resourcesFile);
        }
        String project = resolveProjectName();
        if (!Files.isDirectory(projectRoot.resolve("src").resolve(project))) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Project package src/" + project + " not found under " + projectRoot + "; pass --scan or --resources");
        }
        return ResourceScanner.scan(projectRoot, project);
    }

    private String resolveProjectName() throws IOException {
        if (projectName != null && !projectName.isBlank()) {
            return projectName;
        }
        return ResourceScanner.detectProjectName(projectRoot)
            .orElseThrow(() -> new CommandLine.ParameterException(spec.commandLine(),
                "Cannot detect project name under " + projectRoot + "; pass --project"));
    }

    private PipelineLimits limits() {
        PipelineLimits limits = PipelineLimits.defaults();
        if (maxDepth != null) {
            limits = limits.withMaxDepth(maxDepth);
        }
        if (maxResources != null) {
            limits = limits.withMaxResources(maxResources);
        }
        if (maxParallel != null) {
            limits = limits.withMaxParallelSections(maxParallel);
        }
        if (maxConditionals != null) {
            limits = limits.withMaxConditionalBranches(maxConditionals);
        }
        return limits;
    }

    private void printSyntaxError(PrintWriter err, PipelineSyntaxException e) {
        err.println("Syntax error: " + e.getMessage());
        if (e.hasOffset()) {
            err.println("  " + expression);
            err.println("  " + " ".repeat(e.offset()) + "^");
        }
    }
}
