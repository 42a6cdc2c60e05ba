package dev.pipelines.model;

import dev.pipelines.model.PipelineNode.Branch;
import dev.pipelines.model.PipelineNode.Concurrent;
import dev.pipelines.model.PipelineNode.Resource;
import dev.pipelines.model.PipelineNode.Sequence;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineNodeTest {

    private static final Resource A = new Resource("A", ResourceKind.AGENT);
    private static final Resource B = new Resource("B", ResourceKind.FUNCTION);

    @Test
    void sequenceRequiresAtLeastTwoNodes() {
        assertThatThrownBy(() -> new Sequence(List.of(A)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 2 nodes, got 1");
        assertThatThrownBy(() -> new Sequence(List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void concurrentRequiresAtLeastTwoNodes() {
        assertThatThrownBy(() -> new Concurrent(List.of(A)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Concurrent must have at least 2 nodes");
    }

    @Test
    void branchRequiresNonBlankCondition() {
        assertThatThrownBy(() -> new Branch("  ", A))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("condition cannot be empty");
    }

    @Test
    void resourceRequiresName() {
        assertThatThrownBy(() -> Resource.unresolved(""))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void namesMustBeIdentifiers() {
        assertThatThrownBy(() -> Resource.unresolved("a b"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid resource name 'a b'");
        assertThatThrownBy(() -> new Branch("a'b", A))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Invalid branch condition 'a'b'");
        assertThat(Resource.unresolved("save_data_2").name()).isEqualTo("save_data_2");
    }

    @Test
    void childListIsCopiedAndUnmodifiable() {
        var children = new ArrayList<PipelineNode>(List.of(A, B));
        var sequence = new Sequence(children);
        children.add(A);

        assertThat(sequence.nodes()).hasSize(2);
        assertThatThrownBy(() -> sequence.nodes().add(A))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void describesTree() {
        var tree = new Sequence(List.of(
            A,
            new Concurrent(List.of(B, Resource.unresolved("C"))),
            new Branch("ok", A, B)));

        assertThat(tree.describe())
            .isEqualTo("Sequence([Agent(A) → Concurrent([Function(B) ⇄ Unknown(C)]) → Branch(ok ? Agent(A) : Function(B))])");
        assertThat(new Branch("ok", A).describe()).isEqualTo("Branch(ok ? Agent(A))");
    }

    @Test
    void withKindReturnsSameInstanceWhenUnchanged() {
        assertThat(A.withKind(ResourceKind.AGENT)).isSameAs(A);
        assertThat(Resource.unresolved("X").withKind(ResourceKind.WORKFLOW))
            .isEqualTo(new Resource("X", ResourceKind.WORKFLOW));
    }

    @Test
    void parsesKindLabels() {
        assertThat(ResourceKind.fromLabel("Agent")).isEqualTo(ResourceKind.AGENT);
        assertThat(ResourceKind.fromLabel("workflows")).isEqualTo(ResourceKind.WORKFLOW);
        assertThatThrownBy(() -> ResourceKind.fromLabel("service"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
