package dev.pipelines.engine;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexerTest {

    private static List<TokenKind> kinds(String text) {
        return Lexer.tokenize(text).stream().map(Token::kind).toList();
    }

    @Test
    void tokenizesAllOperators() {
        assertThat(kinds("A → B ⇄ C →? (D, E)")).containsExactly(
            TokenKind.NAME, TokenKind.ARROW, TokenKind.NAME, TokenKind.PARALLEL, TokenKind.NAME,
            TokenKind.CONDITIONAL, TokenKind.LPAREN, TokenKind.NAME, TokenKind.COMMA, TokenKind.NAME,
            TokenKind.RPAREN, TokenKind.END);
    }

    @Test
    void conditionalWinsOverArrowWithoutWhitespace() {
        var tokens = Lexer.tokenize("X→?(A)");

        assertThat(tokens.get(1).kind()).isEqualTo(TokenKind.CONDITIONAL);
        assertThat(tokens.get(1).text()).isEqualTo("→?");
        assertThat(tokens.get(2).offset()).isEqualTo(3);
    }

    @Test
    void namesAreMaximalRunsWithOffsets() {
        var tokens = Lexer.tokenize("  data_fetcher2→Saver");

        assertThat(tokens.get(0).text()).isEqualTo("data_fetcher2");
        assertThat(tokens.get(0).offset()).isEqualTo(2);
        assertThat(tokens.get(2).text()).isEqualTo("Saver");
        assertThat(tokens.get(2).offset()).isEqualTo(16);
    }

    @Test
    void endTokenSitsAtEndOfInput() {
        var tokens = Lexer.tokenize("A ");

        assertThat(tokens).last().satisfies(t -> {
            assertThat(t.kind()).isEqualTo(TokenKind.END);
            assertThat(t.offset()).isEqualTo(2);
        });
    }

    @Test
    void rejectsInvalidCharacterWithOffset() {
        assertThatThrownBy(() -> Lexer.tokenize("A -> B"))
            .isInstanceOfSatisfying(LexException.class, e -> {
                assertThat(e.character()).isEqualTo('-');
                assertThat(e.offset()).isEqualTo(2);
                assertThat(e.getMessage()).isEqualTo("Invalid character '-' at position 2");
            });
    }

    @Test
    void lonelyQuestionMarkIsInvalid() {
        assertThatThrownBy(() -> Lexer.tokenize("A ? B"))
            .isInstanceOf(LexException.class)
            .hasMessageContaining("'?'");
    }
}
