package dev.pipelines.engine;

import dev.pipelines.model.PipelineLimits;
import dev.pipelines.model.PipelineNode;
import dev.pipelines.model.PipelineNode.Branch;
import dev.pipelines.model.PipelineNode.Concurrent;
import dev.pipelines.model.PipelineNode.Resource;
import dev.pipelines.model.PipelineNode.Sequence;
import dev.pipelines.model.PipelineStats;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.entry;

class GraphValidatorTest {

    private static Resource r(String name) {
        return Resource.unresolved(name);
    }

    private static String chainOf(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> "R" + i).collect(Collectors.joining(" → "));
    }

    @Test
    void dependenciesOfSimpleSequence() {
        var validator = new GraphValidator(new Sequence(List.of(r("A"), r("B"), r("C"))));

        assertThat(validator.dependencies()).containsExactly(
            entry("A", List.of()),
            entry("B", List.of("A")),
            entry("C", List.of("A", "B")));
    }

    @Test
    void concurrentChildrenShareEntryPredecessors() {
        var validator = new GraphValidator(PipelineParser.parse("A → B ⇄ C → D"));

        assertThat(validator.dependencies()).containsExactly(
            entry("A", List.of()),
            entry("B", List.of("A")),
            entry("C", List.of("A")),
            entry("D", List.of("A")));
    }

    @Test
    void branchArmsShareEntryPredecessors() {
        var validator = new GraphValidator(PipelineParser.parse("A → ok →? (T, F) → Z"));

        var deps = validator.dependencies();

        assertThat(deps.get("T")).containsExactly("A");
        assertThat(deps.get("F")).containsExactly("A");
        // Leaves inside the branch are not carried forward
        assertThat(deps.get("Z")).containsExactly("A");
    }

    @Test
    void executionOrderFollowsWrittenOrder() {
        var validator = new GraphValidator(PipelineParser.parse("Start → P1 ⇄ P2 → c →? (T, F) → End → Start"));

        assertThat(validator.executionOrder()).containsExactly("Start", "P1", "P2", "T", "F", "End");
    }

    @Test
    void metricsOfMixedPipeline() {
        PipelineNode root = new Sequence(List.of(
            r("Start"),
            new Concurrent(List.of(r("P1"), r("P2"))),
            new Branch("c", r("T"), r("F")),
            r("End")));

        PipelineStats stats = new GraphValidator(root).metrics();

        assertThat(stats.totalResources()).isEqualTo(6);
        assertThat(stats.parallelSections()).isEqualTo(1);
        assertThat(stats.conditionalBranches()).isEqualTo(1);
        assertThat(stats.maxDepth()).isEqualTo(2);
    }

    @Test
    void depthCountsEachCompositeLevel() {
        assertThat(new GraphValidator(r("A")).metrics().maxDepth()).isZero();
        assertThat(new GraphValidator(PipelineParser.parse("A → B")).metrics().maxDepth()).isEqualTo(1);
        assertThat(new GraphValidator(PipelineParser.parse("A → (B → C) ⇄ D")).metrics().maxDepth()).isEqualTo(3);
    }

    @Test
    void repeatedResourcesCountOnce() {
        var stats = new GraphValidator(PipelineParser.parse("A → B → A")).metrics();

        assertThat(stats.totalResources()).isEqualTo(2);
    }

    @Test
    void structuralChecksPassForParsedTrees() {
        for (String expression : List.of(
            "A",
            "A → B → A",
            "(A → B) ⇄ (C → D)",
            "x →? (A → x, B ⇄ x) → x",
            "A ⇄ A ⇄ A")) {
            var validator = new GraphValidator(PipelineParser.parse(expression));

            assertThatCode(validator::validate).doesNotThrowAnyException();
            assertThat(validator.validatePipeline(false).errors()).isEmpty();
        }
    }

    @Test
    void smallPipelineIsValidWithoutWarnings() {
        var result = new GraphValidator(PipelineParser.parse("A → B ⇄ C")).validatePipeline(false);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
        assertThat(result.stats().totalResources()).isEqualTo(3);
    }

    @Test
    void manyResourcesWarnButStayValid() {
        var validator = new GraphValidator(PipelineParser.parse(chainOf(21)));

        var result = validator.validatePipeline(false);

        assertThat(result.valid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).singleElement().asString().contains("many resources");
    }

    @Test
    void strictModeTurnsWarningsIntoErrors() {
        var validator = new GraphValidator(PipelineParser.parse(chainOf(21)));

        var lenient = validator.validatePipeline(false);
        var strict = validator.validatePipeline(true);

        assertThat(strict.valid()).isFalse();
        assertThat(strict.errors()).singleElement().asString()
            .startsWith("Strict mode: ")
            .contains("many resources");
        assertThat(strict.warnings()).isEqualTo(lenient.warnings());
    }

    @Test
    void twentyResourcesDoNotWarn() {
        var result = new GraphValidator(PipelineParser.parse(chainOf(20))).validatePipeline(true);

        assertThat(result.valid()).isTrue();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void deepNestingWarns() {
        var result = new GraphValidator(PipelineParser.parse("a →? (b →? (c →? (d →? (e →? (f →? (X))))))"))
            .validatePipeline(false);

        assertThat(result.stats().maxDepth()).isEqualTo(6);
        assertThat(result.warnings()).anyMatch(w -> w.contains("deeply nested"));
    }

    @Test
    void customLimitsApply() {
        var limits = PipelineLimits.defaults().withMaxParallelSections(0).withMaxConditionalBranches(0);

        var result = new GraphValidator(PipelineParser.parse("A ⇄ B → c →? (D)")).validatePipeline(false, limits);

        assertThat(result.warnings()).hasSize(2)
            .anyMatch(w -> w.contains("parallel sections"))
            .anyMatch(w -> w.contains("conditional branches"));
    }
}
