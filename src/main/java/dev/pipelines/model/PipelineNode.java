package dev.pipelines.model;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A node of the pipeline tree produced by parsing an operator expression.
 * Exactly one of four forms: a resource leaf, a sequence, a concurrent
 * section, or a conditional branch.
 */
public sealed interface PipelineNode {

    /** Readable rendering of the subtree, used in logs and error output. */
    String describe();

    /** Reference to a named agent, workflow or function. */
    record Resource(String name, ResourceKind kind) implements PipelineNode {
        public Resource {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Resource name cannot be empty");
            }
            if (!isName(name)) {
                throw new IllegalArgumentException("Invalid resource name '%s'".formatted(name));
            }
            Objects.requireNonNull(kind, "kind");
        }

        /** A leaf whose kind is resolved later against the resource table. */
        public static Resource unresolved(String name) {
            return new Resource(name, ResourceKind.UNKNOWN);
        }

        public boolean isResolved() {
            return kind != ResourceKind.UNKNOWN;
        }

        public Resource withKind(ResourceKind newKind) {
            return newKind == kind ? this : new Resource(name, newKind);
        }

        @Override
        public String describe() {
            return "%s(%s)".formatted(kind.displayName(), name);
        }
    }

    /** Run children in order, threading one result value through them. */
    record Sequence(List<PipelineNode> nodes) implements PipelineNode {
        public Sequence {
            nodes = requireComposite("Sequence", nodes);
        }

        @Override
        public String describe() {
            return "Sequence([" + join(nodes, " → ") + "])";
        }
    }

    /** Run children together; the result is the list of their results. */
    record Concurrent(List<PipelineNode> nodes) implements PipelineNode {
        public Concurrent {
            nodes = requireComposite("Concurrent", nodes);
        }

        public boolean allResources() {
            return nodes.stream().allMatch(Resource.class::isInstance);
        }

        @Override
        public String describe() {
            return "Concurrent([" + join(nodes, " ⇄ ") + "])";
        }
    }

    /**
     * Run {@code whenTrue} if the field named by {@code condition} is truthy on
     * the running result, otherwise {@code whenFalse} (nullable).
     */
    record Branch(String condition, PipelineNode whenTrue, PipelineNode whenFalse) implements PipelineNode {
        public Branch {
            if (condition == null || condition.isBlank()) {
                throw new IllegalArgumentException("Branch condition cannot be empty");
            }
            if (!isName(condition)) {
                throw new IllegalArgumentException("Invalid branch condition '%s'".formatted(condition));
            }
            Objects.requireNonNull(whenTrue, "whenTrue");
        }

        public Branch(String condition, PipelineNode whenTrue) {
            this(condition, whenTrue, null);
        }

        public boolean hasElse() {
            return whenFalse != null;
        }

        @Override
        public String describe() {
            if (whenFalse == null) {
                return "Branch(%s ? %s)".formatted(condition, whenTrue.describe());
            }
            return "Branch(%s ? %s : %s)".formatted(condition, whenTrue.describe(), whenFalse.describe());
        }
    }

    /** Letters, digits and underscores: the characters a name token is made of. */
    static boolean isNameChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /** True if {@code text} is non-empty and made only of name characters. */
    static boolean isName(String text) {
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (!isNameChar(text.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static List<PipelineNode> requireComposite(String kind, List<PipelineNode> nodes) {
        Objects.requireNonNull(nodes, "nodes");
        if (nodes.size() < 2) {
            throw new IllegalArgumentException(
                "%s must have at least 2 nodes, got %d".formatted(kind, nodes.size()));
        }
        return List.copyOf(nodes);
    }

    private static String join(List<PipelineNode> nodes, String separator) {
        return nodes.stream().map(PipelineNode::describe).collect(Collectors.joining(separator));
    }
}
