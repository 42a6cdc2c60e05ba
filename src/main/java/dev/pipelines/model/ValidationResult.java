package dev.pipelines.model;

import java.util.List;

/**
 * Outcome of validating a pipeline. {@code warnings} are advisory and never
 * affect {@code valid} on their own.
 */
public record ValidationResult(
    boolean valid,
    List<String> errors,
    List<String> warnings,
    PipelineStats stats
) {
    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }
}
