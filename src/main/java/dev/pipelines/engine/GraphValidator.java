package dev.pipelines.engine;

import dev.pipelines.model.PipelineLimits;
import dev.pipelines.model.PipelineNode;
import dev.pipelines.model.PipelineNode.Branch;
import dev.pipelines.model.PipelineNode.Concurrent;
import dev.pipelines.model.PipelineNode.Resource;
import dev.pipelines.model.PipelineNode.Sequence;
import dev.pipelines.model.PipelineStats;
import dev.pipelines.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural analysis of a parsed pipeline tree: invariant checks, execution
 * order, dependency map and metrics. Independent of the resource table.
 *
 * <p>The cycle and unreachable checks cannot fail for a tree built by
 * {@link PipelineParser}: leaves have no children and the tree holds no
 * back-references. They are kept as invariant checks for trees assembled by
 * hand, and would only become meaningful if nodes could refer to ancestors.
 */
public final class GraphValidator {

    private static final Logger log = LoggerFactory.getLogger(GraphValidator.class);

    private final PipelineNode root;
    private final Set<String> allResources;

    public GraphValidator(PipelineNode root) {
        this.root = Objects.requireNonNull(root, "root");
        var names = new LinkedHashSet<String>();
        collectResources(root, names);
        this.allResources = Collections.unmodifiableSet(names);
    }

    /** Every resource name in the tree, in first-seen order. */
    public Set<String> allResources() {
        return allResources;
    }

    /**
     * Run both structural checks.
     *
     * @throws PipelineValidationException on the first failed check
     */
    public void validate() {
        checkCycles();
        checkUnreachable();
    }

    /**
     * Validate the pipeline and compute its metrics, collecting every problem
     * rather than throwing. In strict mode each warning is also reported as an
     * error, prefixed {@code "Strict mode: "}; the warning list is the same
     * either way.
     */
    public ValidationResult validatePipeline(boolean strict, PipelineLimits limits) {
        var errors = new ArrayList<String>();
        try {
            checkCycles();
        } catch (PipelineValidationException e) {
            errors.add(e.getMessage());
        }
        try {
            checkUnreachable();
        } catch (PipelineValidationException e) {
            errors.add(e.getMessage());
        }

        PipelineStats stats = metrics();
        List<String> warnings = warningsFor(stats, limits);
        for (String warning : warnings) {
            log.debug("Pipeline warning: {}", warning);
            if (strict) {
                errors.add("Strict mode: " + warning);
            }
        }
        log.debug("Pipeline metrics: {}", stats);
        return new ValidationResult(errors.isEmpty(), errors, warnings, stats);
    }

    public ValidationResult validatePipeline(boolean strict) {
        return validatePipeline(strict, PipelineLimits.defaults());
    }

    /**
     * Leaf names in depth-first written order, each name once. Branches list
     * the true branch before the false branch. Not a scheduling guarantee.
     */
    public List<String> executionOrder() {
        var order = new LinkedHashSet<String>();
        collectResources(root, order);
        return List.copyOf(order);
    }

    /**
     * For each resource, the names that must run before it. Within a sequence
     * a child depends on the earlier resource leaves of that same sequence;
     * nested concurrent sections and branches do not contribute their leaves.
     * Concurrent children and both branch arms share the predecessors they
     * were entered with.
     */
    public Map<String, List<String>> dependencies() {
        var deps = new LinkedHashMap<String, List<String>>();
        for (String name : allResources) {
            deps.put(name, new ArrayList<>());
        }
        buildDependencies(root, List.of(), deps);

        var result = new LinkedHashMap<String, List<String>>();
        deps.forEach((name, preds) -> result.put(name, List.copyOf(preds)));
        return Collections.unmodifiableMap(result);
    }

    public PipelineStats metrics() {
        var counts = new int[2];
        countSections(root, counts);
        return new PipelineStats(allResources.size(), depth(root), counts[0], counts[1]);
    }

    private void checkCycles() {
        Deque<String> path = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        visitForCycles(root, path, visited);
    }

    private void visitForCycles(PipelineNode node, Deque<String> path, Set<String> visited) {
        if (node instanceof Resource resource) {
            String name = resource.name();
            if (path.contains(name)) {
                var cycle = new ArrayList<String>();
                boolean inCycle = false;
                for (var it = path.descendingIterator(); it.hasNext(); ) {
                    String step = it.next();
                    inCycle = inCycle || step.equals(name);
                    if (inCycle) {
                        cycle.add(step);
                    }
                }
                cycle.add(name);
                throw new PipelineValidationException("Cycle detected: " + String.join(" → ", cycle));
            }
            if (!visited.add(name)) {
                return;
            }
            // Leaves have no children, so the name leaves the stack immediately
            path.push(name);
            path.pop();
            return;
        }
        for (PipelineNode child : childrenOf(node)) {
            visitForCycles(child, path, visited);
        }
    }

    private void checkUnreachable() {
        var reachable = new HashSet<String>();
        collectResources(root, reachable);
        var unreachable = new TreeSet<>(allResources);
        unreachable.removeAll(reachable);
        if (!unreachable.isEmpty()) {
            throw new PipelineValidationException(
                "Unreachable nodes detected: " + String.join(", ", unreachable));
        }
    }

    private static List<String> warningsFor(PipelineStats stats, PipelineLimits limits) {
        var warnings = new ArrayList<String>();
        if (stats.maxDepth() > limits.maxDepth()) {
            warnings.add("Pipeline is deeply nested (depth %d > %d); consider flattening it"
                .formatted(stats.maxDepth(), limits.maxDepth()));
        }
        if (stats.totalResources() > limits.maxResources()) {
            warnings.add("Pipeline has many resources (%d > %d); consider splitting it"
                .formatted(stats.totalResources(), limits.maxResources()));
        }
        if (stats.parallelSections() > limits.maxParallelSections()) {
            warnings.add("Pipeline has many parallel sections (%d > %d)"
                .formatted(stats.parallelSections(), limits.maxParallelSections()));
        }
        if (stats.conditionalBranches() > limits.maxConditionalBranches()) {
            warnings.add("Pipeline has many conditional branches (%d > %d)"
                .formatted(stats.conditionalBranches(), limits.maxConditionalBranches()));
        }
        return warnings;
    }

    private static void buildDependencies(PipelineNode node, List<String> predecessors,
                                          Map<String, List<String>> deps) {
        if (node instanceof Resource resource) {
            deps.get(resource.name()).addAll(predecessors);
        } else if (node instanceof Sequence sequence) {
            var current = new ArrayList<>(predecessors);
            for (PipelineNode child : sequence.nodes()) {
                buildDependencies(child, List.copyOf(current), deps);
                if (child instanceof Resource resource) {
                    current.add(resource.name());
                }
            }
        } else {
            for (PipelineNode child : childrenOf(node)) {
                buildDependencies(child, predecessors, deps);
            }
        }
    }

    private static int depth(PipelineNode node) {
        if (node instanceof Resource) {
            return 0;
        }
        int deepest = 0;
        for (PipelineNode child : childrenOf(node)) {
            deepest = Math.max(deepest, depth(child));
        }
        return deepest + 1;
    }

    /** counts[0] parallel sections, counts[1] conditional branches. */
    private static void countSections(PipelineNode node, int[] counts) {
        if (node instanceof Concurrent) {
            counts[0]++;
        } else if (node instanceof Branch) {
            counts[1]++;
        }
        for (PipelineNode child : childrenOf(node)) {
            countSections(child, counts);
        }
    }

    private static void collectResources(PipelineNode node, Set<String> names) {
        if (node instanceof Resource resource) {
            names.add(resource.name());
            return;
        }
        for (PipelineNode child : childrenOf(node)) {
            collectResources(child, names);
        }
    }

    static List<PipelineNode> childrenOf(PipelineNode node) {
        if (node instanceof Sequence sequence) {
            return sequence.nodes();
        }
        if (node instanceof Concurrent concurrent) {
            return concurrent.nodes();
        }
        if (node instanceof Branch branch) {
            return branch.hasElse() ? List.of(branch.whenTrue(), branch.whenFalse()) : List.of(branch.whenTrue());
        }
        return List.of();
    }
}
