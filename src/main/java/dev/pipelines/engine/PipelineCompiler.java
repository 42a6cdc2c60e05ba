package dev.pipelines.engine;

import dev.pipelines.model.CompilationResult;
import dev.pipelines.model.PipelineLimits;
import dev.pipelines.model.PipelineNode;
import dev.pipelines.model.Resolution;
import dev.pipelines.model.ResourceKind;
import dev.pipelines.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the full compilation: parse, resolve resource kinds, validate the
 * graph, generate source.
 *
 * <p>Syntax errors abort with a {@link PipelineSyntaxException}. Resource and
 * graph problems are reported through {@link CompilationResult.Rejected} so
 * callers can print them all at once. Instances hold only configuration and
 * may be shared between threads.
 */
public final class PipelineCompiler {

    private static final Logger log = LoggerFactory.getLogger(PipelineCompiler.class);

    private final Map<String, ResourceKind> resources;
    private final PipelineLimits limits;
    private final boolean strict;

    public PipelineCompiler(Map<String, ResourceKind> resources, PipelineLimits limits, boolean strict) {
        this.resources = Map.copyOf(Objects.requireNonNull(resources, "resources"));
        this.limits = Objects.requireNonNull(limits, "limits");
        this.strict = strict;
    }

    public PipelineCompiler(Map<String, ResourceKind> resources) {
        this(resources, PipelineLimits.defaults(), false);
    }

    /**
     * Compile {@code expression} into the source of workflow {@code pipelineName}.
     *
     * @throws PipelineSyntaxException if the expression is empty or malformed
     */
    public CompilationResult compile(String expression, String pipelineName, String projectName) {
        PipelineNode parsed = PipelineParser.parse(expression);
        Resolution resolution = ResourceValidator.resolve(parsed, resources);

        ValidationResult validation = validate(parsed, resolution);
        if (!(resolution instanceof Resolution.Resolved resolved)) {
            return new CompilationResult.Rejected(parsed, validation.errors(), validation.warnings());
        }
        if (!validation.valid()) {
            return new CompilationResult.Rejected(resolved.node(), validation.errors(), validation.warnings());
        }

        String source = PipelineCodeGenerator.generate(resolved.node(), pipelineName, projectName);
        log.debug("Compiled pipeline {} ({} characters)", pipelineName, source.length());
        return new CompilationResult.Compiled(resolved.node(), validation, source);
    }

    /**
     * Parse and resolve {@code expression} without generating code.
     *
     * @throws PipelineSyntaxException if the expression is empty or malformed
     * @throws IllegalStateException if a resource is missing or has the wrong kind
     */
    public PipelineNode parseAndResolve(String expression) {
        PipelineNode parsed = PipelineParser.parse(expression);
        Resolution resolution = ResourceValidator.resolve(parsed, resources);
        if (resolution instanceof Resolution.Unresolved unresolved) {
            throw new IllegalStateException("Validation error: " + unresolved.error());
        }
        return ((Resolution.Resolved) resolution).node();
    }

    /** Parse, resolve and validate {@code expression} without generating code. */
    public ValidationResult check(String expression) {
        PipelineNode parsed = PipelineParser.parse(expression);
        return validate(parsed, ResourceValidator.resolve(parsed, resources));
    }

    /**
     * Graph findings for the resolved tree, or the resource error followed by
     * the graph findings for the parsed tree when resolution failed.
     */
    private ValidationResult validate(PipelineNode parsed, Resolution resolution) {
        if (resolution instanceof Resolution.Resolved resolved) {
            return new GraphValidator(resolved.node()).validatePipeline(strict, limits);
        }
        String resourceError = ((Resolution.Unresolved) resolution).error();
        log.debug("Resource resolution failed: {}", resourceError);
        ValidationResult structural = new GraphValidator(parsed).validatePipeline(strict, limits);
        var errors = new ArrayList<String>();
        errors.add(resourceError);
        errors.addAll(structural.errors());
        return new ValidationResult(false, errors, structural.warnings(), structural.stats());
    }

    public PipelineLimits limits() {
        return limits;
    }

    public boolean strict() {
        return strict;
    }
}
