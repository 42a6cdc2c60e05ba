package dev.pipelines.engine;

/**
 * Raised when the generator meets a node it cannot translate. Indicates a
 * programming error rather than bad input.
 */
public final class CodegenException extends RuntimeException {

    public CodegenException(String message) {
        super(message);
    }
}
