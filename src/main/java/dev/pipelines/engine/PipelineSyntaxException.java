package dev.pipelines.engine;

/**
 * Base class for errors that abort compilation because the expression itself
 * is malformed.
 */
public abstract class PipelineSyntaxException extends RuntimeException {

    /** Used when no source position applies, e.g. for empty input. */
    public static final int NO_OFFSET = -1;

    private final int offset;

    protected PipelineSyntaxException(String message, int offset) {
        super(message);
        this.offset = offset;
    }

    /** 0-based character offset of the error, or {@link #NO_OFFSET}. */
    public int offset() {
        return offset;
    }

    public boolean hasOffset() {
        return offset >= 0;
    }
}
