package dev.pipelines.project;

import dev.pipelines.model.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a resource table by scanning a Restack project laid out as
 * {@code src/<project>/{agents,workflows,functions}/*.py}.
 *
 * <p>Each module registers several names so expressions may refer to it the
 * way users naturally would. For {@code agents/data_fetcher.py}:
 * {@code DataFetcherAgent}, {@code DataFetcher} and {@code data_fetcher}.
 * Functions register only the snake_case and PascalCase forms. The first
 * registration of a name wins.
 */
public final class ResourceScanner {

    private static final Logger log = LoggerFactory.getLogger(ResourceScanner.class);

    private static final String INIT_MODULE = "__init__.py";

    private ResourceScanner() {}

    /**
     * Find the project name: the only directory under {@code src/}.
     */
    public static Optional<String> detectProjectName(Path projectRoot) throws IOException {
        Path src = projectRoot.resolve("src");
        if (!Files.isDirectory(src)) {
            return Optional.empty();
        }
        List<String> candidates;
        try (Stream<Path> entries = Files.list(src)) {
            candidates = entries.filter(Files::isDirectory)
                .map(p -> p.getFileName().toString())
                .filter(name -> !name.startsWith(".") && !name.endsWith(".egg-info"))
                .sorted()
                .collect(Collectors.toList());
        }
        if (candidates.size() != 1) {
            log.debug("Cannot detect project name under {}: candidates {}", src, candidates);
            return Optional.empty();
        }
        return Optional.of(candidates.get(0));
    }

    /**
     * Scan {@code src/<projectName>} under {@code projectRoot}. Missing
     * resource directories are skipped.
     */
    public static Map<String, ResourceKind> scan(Path projectRoot, String projectName) throws IOException {
        Path packageDir = projectRoot.resolve("src").resolve(projectName);
        if (!Files.isDirectory(packageDir)) {
            throw new IOException("Project package not found: " + packageDir);
        }

        var table = new LinkedHashMap<String, ResourceKind>();
        for (String module : modules(packageDir.resolve("agents"))) {
            String base = toPascalCase(module);
            register(table, base + "Agent", ResourceKind.AGENT);
            register(table, base, ResourceKind.AGENT);
            register(table, module, ResourceKind.AGENT);
        }
        for (String module : modules(packageDir.resolve("workflows"))) {
            String base = toPascalCase(module);
            register(table, base + "Workflow", ResourceKind.WORKFLOW);
            register(table, base, ResourceKind.WORKFLOW);
            register(table, module, ResourceKind.WORKFLOW);
        }
        for (String module : modules(packageDir.resolve("functions"))) {
            register(table, module, ResourceKind.FUNCTION);
            register(table, toPascalCase(module), ResourceKind.FUNCTION);
        }
        log.debug("Scanned {} resource names under {}", table.size(), packageDir);
        return Collections.unmodifiableMap(table);
    }

    /** {@code data_fetcher} becomes {@code DataFetcher}. */
    static String toPascalCase(String snake) {
        return Arrays.stream(snake.split("_"))
            .filter(part -> !part.isEmpty())
            .map(part -> part.substring(0, 1).toUpperCase(Locale.ROOT) + part.substring(1).toLowerCase(Locale.ROOT))
            .collect(Collectors.joining());
    }

    private static List<String> modules(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.map(p -> p.getFileName().toString())
                .filter(name -> name.endsWith(".py") && !name.equals(INIT_MODULE))
                .map(name -> name.substring(0, name.length() - ".py".length()))
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static void register(Map<String, ResourceKind> table, String name, ResourceKind kind) {
        if (!name.isEmpty()) {
            table.putIfAbsent(name, kind);
        }
    }
}
