package dev.pipelines.engine;

import dev.pipelines.model.PipelineNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an operator expression into tokens.
 *
 * <p>Operators are {@code →} (sequence), {@code ⇄} (parallel) and {@code →?}
 * (conditional). Names are maximal runs of letters, digits and underscores.
 * Whitespace separates tokens and is otherwise ignored.
 */
public final class Lexer {

    static final char ARROW = '→';
    static final char PARALLEL = '⇄';
    static final String CONDITIONAL = "→?";

    private Lexer() {}

    /**
     * Tokenize an expression. The returned list always ends with an
     * {@link TokenKind#END} token positioned at the end of the input.
     *
     * @throws LexException on the first character that starts no token
     */
    public static List<Token> tokenize(String text) {
        var tokens = new ArrayList<Token>();
        int pos = 0;
        int length = text.length();

        while (pos < length) {
            char c = text.charAt(pos);

            if (Character.isWhitespace(c)) {
                pos++;
                continue;
            }

            // Longest match first: →? before →
            if (text.startsWith(CONDITIONAL, pos)) {
                tokens.add(new Token(TokenKind.CONDITIONAL, CONDITIONAL, pos));
                pos += CONDITIONAL.length();
                continue;
            }

            TokenKind single = switch (c) {
                case ARROW -> TokenKind.ARROW;
                case PARALLEL -> TokenKind.PARALLEL;
                case ',' -> TokenKind.COMMA;
                case '(' -> TokenKind.LPAREN;
                case ')' -> TokenKind.RPAREN;
                default -> null;
            };
            if (single != null) {
                tokens.add(new Token(single, String.valueOf(c), pos));
                pos++;
                continue;
            }

            if (PipelineNode.isNameChar(c)) {
                int start = pos;
                while (pos < length && PipelineNode.isNameChar(text.charAt(pos))) {
                    pos++;
                }
                tokens.add(new Token(TokenKind.NAME, text.substring(start, pos), start));
                continue;
            }

            throw new LexException(c, pos);
        }

        tokens.add(new Token(TokenKind.END, "", pos));
        return tokens;
    }
}
