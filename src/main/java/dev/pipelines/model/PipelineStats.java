package dev.pipelines.model;

/**
 * Structural metrics of a pipeline tree.
 */
public record PipelineStats(
    int totalResources,
    int maxDepth,
    int parallelSections,
    int conditionalBranches
) {}
