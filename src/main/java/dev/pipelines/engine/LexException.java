package dev.pipelines.engine;

/**
 * Raised when the expression contains a character outside the language.
 */
public final class LexException extends PipelineSyntaxException {

    private final char character;

    public LexException(char character, int offset) {
        super("Invalid character '%s' at position %d".formatted(character, offset), offset);
        this.character = character;
    }

    public char character() {
        return character;
    }
}
