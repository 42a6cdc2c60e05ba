package dev.pipelines.project;

import dev.pipelines.model.ResourceKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceScannerTest {

    @TempDir
    Path root;

    @BeforeEach
    void createProject() throws IOException {
        Path pkg = root.resolve("src/email_pipeline");
        for (String file : new String[] {
            "agents/__init__.py", "agents/spam_checker.py", "agents/email_validator.py",
            "workflows/router.py", "functions/virus_scan.py", "common/settings.py"}) {
            Path path = pkg.resolve(file);
            Files.createDirectories(path.getParent());
            Files.writeString(path, "# generated\n");
        }
    }

    @Test
    void detectsProjectName() throws IOException {
        assertThat(ResourceScanner.detectProjectName(root)).contains("email_pipeline");
    }

    @Test
    void projectNameIsAmbiguousWithSeveralPackages() throws IOException {
        Files.createDirectories(root.resolve("src/other"));

        assertThat(ResourceScanner.detectProjectName(root)).isEmpty();
    }

    @Test
    void registersNameVariantsPerKind() throws IOException {
        var table = ResourceScanner.scan(root, "email_pipeline");

        assertThat(table)
            .containsEntry("SpamCheckerAgent", ResourceKind.AGENT)
            .containsEntry("SpamChecker", ResourceKind.AGENT)
            .containsEntry("spam_checker", ResourceKind.AGENT)
            .containsEntry("EmailValidator", ResourceKind.AGENT)
            .containsEntry("RouterWorkflow", ResourceKind.WORKFLOW)
            .containsEntry("Router", ResourceKind.WORKFLOW)
            .containsEntry("router", ResourceKind.WORKFLOW)
            .containsEntry("virus_scan", ResourceKind.FUNCTION)
            .containsEntry("VirusScan", ResourceKind.FUNCTION)
            .doesNotContainKey("VirusScanFunction")
            .doesNotContainKey("__init__")
            .doesNotContainKey("Settings");
        assertThat(table).hasSize(11);
    }

    @Test
    void earlierKindWinsOnNameClash() throws IOException {
        Files.writeString(root.resolve("src/email_pipeline/functions/router.py"), "");

        var table = ResourceScanner.scan(root, "email_pipeline");

        assertThat(table).containsEntry("router", ResourceKind.WORKFLOW);
    }

    @Test
    void failsWhenPackageMissing() {
        assertThatThrownBy(() -> ResourceScanner.scan(root, "nope"))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("Project package not found");
    }

    @Test
    void convertsModuleNamesToPascalCase() {
        assertThat(ResourceScanner.toPascalCase("data_fetcher")).isEqualTo("DataFetcher");
        assertThat(ResourceScanner.toPascalCase("fetch")).isEqualTo("Fetch");
    }
}
