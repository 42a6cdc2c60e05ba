package dev.pipelines.engine;

/**
 * Raised when the token stream does not match the expression grammar.
 */
public final class ParseException extends PipelineSyntaxException {

    public ParseException(String message, int offset) {
        super(message, offset);
    }

    public ParseException(String message) {
        super(message, NO_OFFSET);
    }
}
