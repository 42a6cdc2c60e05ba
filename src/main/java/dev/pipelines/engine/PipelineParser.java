package dev.pipelines.engine;

import dev.pipelines.model.PipelineNode;
import dev.pipelines.model.PipelineNode.Branch;
import dev.pipelines.model.PipelineNode.Concurrent;
import dev.pipelines.model.PipelineNode.Resource;
import dev.pipelines.model.PipelineNode.Sequence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for operator expressions.
 *
 * <pre>
 * expression  := sequence
 * sequence    := conditional (ARROW conditional)*
 * conditional := parallel (CONDITIONAL LPAREN expression (COMMA expression)? RPAREN)*
 * parallel    := primary (PARALLEL primary)*
 * primary     := NAME | LPAREN expression RPAREN
 * </pre>
 *
 * Parallel binds tightest, then conditional, then sequence. Every leaf is
 * produced with an unknown kind; kinds are filled in by {@link ResourceValidator}.
 */
public final class PipelineParser {

    private static final Logger log = LoggerFactory.getLogger(PipelineParser.class);

    private final List<Token> tokens;
    private int position;

    PipelineParser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).kind() != TokenKind.END) {
            throw new IllegalArgumentException("Token list must end with an END token");
        }
        this.tokens = tokens;
        this.position = 0;
    }

    /**
     * Parse an expression into a flattened pipeline tree.
     *
     * @throws ParseException if the expression is blank or does not match the grammar
     * @throws LexException if the expression contains an invalid character
     */
    public static PipelineNode parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ParseException("Empty expression");
        }
        List<Token> tokens = Lexer.tokenize(expression);
        log.debug("Tokenized expression into {} tokens", tokens.size());

        var parser = new PipelineParser(tokens);
        PipelineNode root = parser.parseExpression();
        Token trailing = parser.current();
        if (trailing.kind() != TokenKind.END) {
            throw unexpected(trailing);
        }

        PipelineNode flat = flatten(root);
        log.debug("Parsed pipeline: {}", flat.describe());
        return flat;
    }

    /**
     * Merge directly nested sequences into their parent sequence and directly
     * nested concurrent sections into their parent section. Branch boundaries
     * are kept; branches are flattened on their own.
     */
    public static PipelineNode flatten(PipelineNode node) {
        if (node instanceof Sequence sequence) {
            var merged = new ArrayList<PipelineNode>();
            for (PipelineNode child : sequence.nodes()) {
                PipelineNode flatChild = flatten(child);
                if (flatChild instanceof Sequence inner) {
                    merged.addAll(inner.nodes());
                } else {
                    merged.add(flatChild);
                }
            }
            return new Sequence(merged);
        }
        if (node instanceof Concurrent concurrent) {
            var merged = new ArrayList<PipelineNode>();
            for (PipelineNode child : concurrent.nodes()) {
                PipelineNode flatChild = flatten(child);
                if (flatChild instanceof Concurrent inner) {
                    merged.addAll(inner.nodes());
                } else {
                    merged.add(flatChild);
                }
            }
            return new Concurrent(merged);
        }
        if (node instanceof Branch branch) {
            return new Branch(branch.condition(), flatten(branch.whenTrue()),
                branch.hasElse() ? flatten(branch.whenFalse()) : null);
        }
        return node;
    }

    PipelineNode parseExpression() {
        return parseSequence();
    }

    private PipelineNode parseSequence() {
        var nodes = new ArrayList<PipelineNode>();
        nodes.add(parseConditional());
        while (current().kind() == TokenKind.ARROW) {
            advance();
            nodes.add(parseConditional());
        }
        return nodes.size() == 1 ? nodes.get(0) : new Sequence(nodes);
    }

    private PipelineNode parseConditional() {
        PipelineNode node = parseParallel();

        while (current().kind() == TokenKind.CONDITIONAL) {
            Token operator = advance();
            // The left operand names the field the branch tests
            if (!(node instanceof Resource condition)) {
                throw new ParseException(
                    "Conditional operator requires a resource name before →? at position %d"
                        .formatted(operator.offset()),
                    operator.offset());
            }

            expect(TokenKind.LPAREN);
            PipelineNode whenTrue = parseExpression();
            PipelineNode whenFalse = null;
            if (current().kind() == TokenKind.COMMA) {
                advance();
                whenFalse = parseExpression();
            }
            expect(TokenKind.RPAREN);
            node = new Branch(condition.name(), whenTrue, whenFalse);
        }
        return node;
    }

    private PipelineNode parseParallel() {
        var nodes = new ArrayList<PipelineNode>();
        nodes.add(parsePrimary());
        while (current().kind() == TokenKind.PARALLEL) {
            advance();
            nodes.add(parsePrimary());
        }
        return nodes.size() == 1 ? nodes.get(0) : new Concurrent(nodes);
    }

    private PipelineNode parsePrimary() {
        Token token = current();
        if (token.kind() == TokenKind.LPAREN) {
            advance();
            PipelineNode inner = parseExpression();
            expect(TokenKind.RPAREN);
            return inner;
        }
        if (token.kind() == TokenKind.NAME) {
            advance();
            return Resource.unresolved(token.text());
        }
        throw unexpected(token);
    }

    private Token current() {
        return tokens.get(position);
    }

    /** Consume the current token. Never moves past END. */
    private Token advance() {
        Token token = current();
        if (position < tokens.size() - 1) {
            position++;
        }
        return token;
    }

    private Token expect(TokenKind kind) {
        Token token = current();
        if (token.kind() != kind) {
            throw new ParseException(
                "Expected %s, got %s at position %d".formatted(kind, token.kind(), token.offset()),
                token.offset());
        }
        return advance();
    }

    private static ParseException unexpected(Token token) {
        return new ParseException(
            "Unexpected token %s at position %d".formatted(token.kind(), token.offset()),
            token.offset());
    }
}
