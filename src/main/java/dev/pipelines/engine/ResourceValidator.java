package dev.pipelines.engine;

import dev.pipelines.model.PipelineNode;
import dev.pipelines.model.PipelineNode.Branch;
import dev.pipelines.model.PipelineNode.Concurrent;
import dev.pipelines.model.PipelineNode.Resource;
import dev.pipelines.model.PipelineNode.Sequence;
import dev.pipelines.model.Resolution;
import dev.pipelines.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Checks every resource leaf against the project's resource table and fills
 * in the kind of leaves parsed without one.
 *
 * <p>Records are immutable, so resolution rebuilds the tree. The input tree is
 * never modified and resolving an already resolved tree yields an equal tree.
 */
public final class ResourceValidator {

    private static final Logger log = LoggerFactory.getLogger(ResourceValidator.class);

    private ResourceValidator() {}

    /**
     * Resolve all leaves of {@code node}. Stops at the first failing leaf, in
     * written order, and reports it as {@link Resolution.Unresolved}.
     *
     * @param table resource name to kind, as built by the project scanner
     */
    public static Resolution resolve(PipelineNode node, Map<String, ResourceKind> table) {
        Objects.requireNonNull(node, "node");
        Objects.requireNonNull(table, "table");
        try {
            return new Resolution.Resolved(resolveNode(node, table));
        } catch (UnresolvedResourceException e) {
            return new Resolution.Unresolved(e.getMessage());
        }
    }

    private static PipelineNode resolveNode(PipelineNode node, Map<String, ResourceKind> table) {
        if (node instanceof Resource resource) {
            return resolveResource(resource, table);
        }
        if (node instanceof Sequence sequence) {
            return new Sequence(resolveAll(sequence.nodes(), table));
        }
        if (node instanceof Concurrent concurrent) {
            return new Concurrent(resolveAll(concurrent.nodes(), table));
        }
        if (node instanceof Branch branch) {
            PipelineNode whenTrue = resolveNode(branch.whenTrue(), table);
            PipelineNode whenFalse = branch.hasElse() ? resolveNode(branch.whenFalse(), table) : null;
            return new Branch(branch.condition(), whenTrue, whenFalse);
        }
        throw new UnresolvedResourceException("Unknown node type: " + node.getClass().getSimpleName());
    }

    private static List<PipelineNode> resolveAll(List<PipelineNode> nodes, Map<String, ResourceKind> table) {
        var resolved = new ArrayList<PipelineNode>(nodes.size());
        for (PipelineNode child : nodes) {
            resolved.add(resolveNode(child, table));
        }
        return resolved;
    }

    private static Resource resolveResource(Resource resource, Map<String, ResourceKind> table) {
        ResourceKind tableKind = table.get(resource.name());
        if (tableKind == null) {
            throw new UnresolvedResourceException("resource '%s' not found".formatted(resource.name()));
        }
        if (resource.isResolved()) {
            if (resource.kind() != tableKind) {
                throw new UnresolvedResourceException("resource '%s' is a %s, not a %s"
                    .formatted(resource.name(), tableKind.label(), resource.kind().label()));
            }
            return resource;
        }
        log.debug("Resolved resource '{}' as {}", resource.name(), tableKind.label());
        return resource.withKind(tableKind);
    }

    /** Unwinds the recursion on the first failing leaf. */
    private static final class UnresolvedResourceException extends RuntimeException {
        UnresolvedResourceException(String message) {
            super(message, null, false, false);
        }
    }
}
