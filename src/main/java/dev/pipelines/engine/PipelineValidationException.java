package dev.pipelines.engine;

/**
 * Raised by the structural graph checks. {@link GraphValidator#validatePipeline}
 * collects these as error strings instead of propagating them.
 */
public final class PipelineValidationException extends RuntimeException {

    public PipelineValidationException(String message) {
        super(message);
    }
}
