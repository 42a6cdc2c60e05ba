package dev.pipelines.engine;

import dev.pipelines.model.PipelineNode;
import dev.pipelines.model.PipelineNode.Branch;
import dev.pipelines.model.PipelineNode.Concurrent;
import dev.pipelines.model.PipelineNode.Resource;
import dev.pipelines.model.PipelineNode.Sequence;
import dev.pipelines.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Translates a resolved pipeline tree into the source of a Restack workflow
 * class whose {@code execute} step runs the pipeline.
 *
 * <p>One {@code result} binding is threaded through the generated body: each
 * activity receives the current value and replaces it with its return value.
 * A parallel section replaces it with the list of its children's results.
 */
public final class PipelineCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCodeGenerator.class);

    static final String WORKFLOW_IMPORT = "from restack_ai import Workflow, step";
    static final String CONCURRENCY_IMPORT = "import asyncio";
    static final String RESULT = "result";
    static final String UNSUPPORTED_PARALLEL =
        "# Unsupported: parallel section with nested composition; only resources can run in parallel";

    private static final String INDENT = "    ";
    private static final int BODY_LEVEL = 2;

    private static final String TEMPLATE = """
        \"""
        %1$s workflow.

        Auto-generated pipeline from operator expression.
        \"""

        %2$s


        class %1$s(Workflow):
            \"""Pipeline workflow: %1$s.\"""

            @step
            async def execute(self, input_data: dict) -> dict:
                \"""
                Execute the pipeline.

                Args:
                    input_data: Input data for the pipeline

                Returns:
                    Pipeline execution result
                \"""
                result = input_data
        %3$s        return result
        """;

    private PipelineCodeGenerator() {}

    /**
     * Generate the workflow source for {@code ir}.
     *
     * @param pipelineName class name of the generated workflow, used verbatim
     * @param projectName  top-level package the resources are imported from
     */
    public static String generate(PipelineNode ir, String pipelineName, String projectName) {
        Objects.requireNonNull(ir, "ir");
        requireName(pipelineName, "Pipeline name");
        requireName(projectName, "Project name");

        String imports = String.join("\n", imports(ir, projectName));
        var body = new StringBuilder();
        emit(ir, BODY_LEVEL, body);

        log.debug("Generating workflow {} for {}", pipelineName, ir.describe());
        return TEMPLATE.formatted(pipelineName, imports, body);
    }

    /**
     * Import lines for {@code ir}: the workflow primitives, {@code asyncio} when
     * the tree has a parallel section, then one import per resource grouped by
     * kind (agents, workflows, functions) and sorted by name.
     */
    public static List<String> imports(PipelineNode ir, String projectName) {
        var imports = new ArrayList<String>();
        imports.add(WORKFLOW_IMPORT);
        if (hasConcurrent(ir)) {
            imports.add(CONCURRENCY_IMPORT);
        }

        Map<ResourceKind, TreeSet<String>> byKind = new EnumMap<>(ResourceKind.class);
        collectResources(ir, byKind);
        byKind.forEach((kind, names) -> {
            if (kind == ResourceKind.UNKNOWN) {
                log.warn("Skipping imports for unresolved resources: {}", names);
                return;
            }
            for (String name : names) {
                imports.add("from %s.%ss.%s import %s"
                    .formatted(projectName, kind.label(), toSnakeCase(name), name));
            }
        });
        return imports;
    }

    /**
     * Convert a PascalCase or camelCase name to snake_case. An underscore goes
     * before an uppercase letter only when the previous character is
     * lowercase, so acronyms stay together: {@code HTTPFetcher} becomes
     * {@code httpfetcher}.
     */
    public static String toSnakeCase(String name) {
        var sb = new StringBuilder(name.length() + 4);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (i > 0 && Character.isUpperCase(c) && Character.isLowerCase(name.charAt(i - 1))) {
                sb.append('_');
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    static String activityName(Resource resource) {
        return toSnakeCase(resource.name()) + "_activity";
    }

    static boolean hasConcurrent(PipelineNode node) {
        if (node instanceof Concurrent) {
            return true;
        }
        if (node instanceof Sequence sequence) {
            return sequence.nodes().stream().anyMatch(PipelineCodeGenerator::hasConcurrent);
        }
        if (node instanceof Branch branch) {
            return hasConcurrent(branch.whenTrue()) || (branch.hasElse() && hasConcurrent(branch.whenFalse()));
        }
        return false;
    }

    private static void emit(PipelineNode node, int level, StringBuilder out) {
        if (node instanceof Resource resource) {
            emitResource(resource, level, out);
        } else if (node instanceof Sequence sequence) {
            for (PipelineNode child : sequence.nodes()) {
                emit(child, level, out);
            }
        } else if (node instanceof Concurrent concurrent) {
            emitConcurrent(concurrent, level, out);
        } else if (node instanceof Branch branch) {
            emitBranch(branch, level, out);
        } else {
            throw new CodegenException("Unknown node type: " + node.getClass().getName());
        }
    }

    private static void emitResource(Resource resource, int level, StringBuilder out) {
        line(out, level, "%s = await self.execute_activity(%s, %s)"
            .formatted(RESULT, activityName(resource), RESULT));
    }

    private static void emitConcurrent(Concurrent concurrent, int level, StringBuilder out) {
        if (!concurrent.allResources()) {
            line(out, level, UNSUPPORTED_PARALLEL);
            line(out, level, "pass");
            return;
        }
        line(out, level, "results = await asyncio.gather(");
        List<PipelineNode> nodes = concurrent.nodes();
        for (int i = 0; i < nodes.size(); i++) {
            String call = "self.execute_activity(%s, %s)".formatted(activityName((Resource) nodes.get(i)), RESULT);
            line(out, level + 1, i < nodes.size() - 1 ? call + "," : call);
        }
        line(out, level, ")");
        line(out, level, RESULT + " = results");
    }

    private static void emitBranch(Branch branch, int level, StringBuilder out) {
        line(out, level, "if %s.get('%s'):".formatted(RESULT, branch.condition()));
        emit(branch.whenTrue(), level + 1, out);
        if (branch.hasElse()) {
            line(out, level, "else:");
            emit(branch.whenFalse(), level + 1, out);
        }
    }

    private static void collectResources(PipelineNode node, Map<ResourceKind, TreeSet<String>> byKind) {
        if (node instanceof Resource resource) {
            byKind.computeIfAbsent(resource.kind(), k -> new TreeSet<>()).add(resource.name());
            return;
        }
        for (PipelineNode child : GraphValidator.childrenOf(node)) {
            collectResources(child, byKind);
        }
    }

    private static void line(StringBuilder out, int level, String text) {
        out.append(INDENT.repeat(level)).append(text).append('\n');
    }

    private static void requireName(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(what + " cannot be empty");
        }
    }
}
