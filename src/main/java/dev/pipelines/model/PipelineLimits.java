package dev.pipelines.model;

/**
 * Thresholds above which a pipeline draws an advisory warning.
 */
public record PipelineLimits(
    int maxDepth,
    int maxResources,
    int maxParallelSections,
    int maxConditionalBranches
) {
    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final int DEFAULT_MAX_RESOURCES = 20;
    public static final int DEFAULT_MAX_PARALLEL_SECTIONS = 10;
    public static final int DEFAULT_MAX_CONDITIONAL_BRANCHES = 10;

    public static PipelineLimits defaults() {
        return new PipelineLimits(DEFAULT_MAX_DEPTH, DEFAULT_MAX_RESOURCES,
            DEFAULT_MAX_PARALLEL_SECTIONS, DEFAULT_MAX_CONDITIONAL_BRANCHES);
    }

    public PipelineLimits withMaxDepth(int value) {
        return new PipelineLimits(value, maxResources, maxParallelSections, maxConditionalBranches);
    }

    public PipelineLimits withMaxResources(int value) {
        return new PipelineLimits(maxDepth, value, maxParallelSections, maxConditionalBranches);
    }

    public PipelineLimits withMaxParallelSections(int value) {
        return new PipelineLimits(maxDepth, maxResources, value, maxConditionalBranches);
    }

    public PipelineLimits withMaxConditionalBranches(int value) {
        return new PipelineLimits(maxDepth, maxResources, maxParallelSections, value);
    }
}
