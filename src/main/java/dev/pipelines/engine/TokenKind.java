package dev.pipelines.engine;

/**
 * Token kinds of the operator expression language.
 */
public enum TokenKind {
    NAME,
    ARROW,
    PARALLEL,
    CONDITIONAL,
    COMMA,
    LPAREN,
    RPAREN,
    END
}
