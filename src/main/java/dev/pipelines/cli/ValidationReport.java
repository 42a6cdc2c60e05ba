package dev.pipelines.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pipelines.model.PipelineStats;
import dev.pipelines.model.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Renders validation results, execution order and dependency maps for the
 * terminal or as JSON.
 */
public final class ValidationReport {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ValidationReport() {}

    public static String render(ValidationResult result, ReportFormat format) {
        return format == ReportFormat.JSON ? toJson(result) : toText(result);
    }

    public static String toText(ValidationResult result) {
        var sb = new StringBuilder();
        sb.append(result.valid() ? "Pipeline is valid" : "Pipeline is invalid").append('\n');
        if (result.stats() != null) {
            PipelineStats stats = result.stats();
            sb.append("  resources: ").append(stats.totalResources())
              .append(", max depth: ").append(stats.maxDepth())
              .append(", parallel sections: ").append(stats.parallelSections())
              .append(", conditional branches: ").append(stats.conditionalBranches())
              .append('\n');
        }
        appendSection(sb, "Errors", result.errors());
        appendSection(sb, "Warnings", result.warnings());
        return sb.toString();
    }

    public static String toJson(ValidationResult result) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise validation result", e);
        }
    }

    /**
     * Execution order on one line, then one line per resource listing what it
     * depends on.
     */
    public static String graph(List<String> order, Map<String, List<String>> dependencies) {
        var sb = new StringBuilder();
        sb.append("Execution order: ").append(String.join(" → ", order)).append('\n');
        sb.append("Dependencies:\n");
        dependencies.forEach((name, preds) -> sb.append("  ").append(name).append(": ")
            .append(preds.isEmpty() ? "(none)" : String.join(", ", preds)).append('\n'));
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String title, List<String> lines) {
        if (lines.isEmpty()) {
            return;
        }
        sb.append(title).append(":\n");
        for (String line : lines) {
            sb.append("  - ").append(line).append('\n');
        }
    }
}
