package dev.pipelines.model;

import java.util.List;

/**
 * Result of compiling an operator expression end to end.
 */
public sealed interface CompilationResult {

    /** Source was generated; {@code validation} may still carry warnings. */
    record Compiled(PipelineNode ir, ValidationResult validation, String source) implements CompilationResult {}

    /**
     * The expression parsed but failed resource or graph validation.
     * {@code ir} is the unresolved tree when resource resolution failed.
     */
    record Rejected(PipelineNode ir, List<String> errors, List<String> warnings) implements CompilationResult {
        public Rejected {
            errors = List.copyOf(errors);
            warnings = List.copyOf(warnings);
        }
    }
}
