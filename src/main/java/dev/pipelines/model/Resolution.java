package dev.pipelines.model;

/**
 * Result of resolving resource kinds against the resource table.
 */
public sealed interface Resolution {

    /** Every leaf was found; {@code node} is the tree with all kinds filled in. */
    record Resolved(PipelineNode node) implements Resolution {}

    /** The first leaf that failed, described by {@code error}. */
    record Unresolved(String error) implements Resolution {}
}
