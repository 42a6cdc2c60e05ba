package dev.pipelines.engine;

/**
 * A lexed token. {@code offset} is the 0-based character index in the source.
 */
public record Token(TokenKind kind, String text, int offset) {

    @Override
    public String toString() {
        return "Token(%s, '%s', pos=%d)".formatted(kind, text, offset);
    }
}
