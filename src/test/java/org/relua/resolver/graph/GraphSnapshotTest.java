package org.relua.resolver.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
public class GraphSnapshotTest {

    private static GraphSnapshot diamond() {
        DependencyGraph graph = new DependencyGraph();
        graph.addRoot("A", "a");
        graph.addEdge("A", "B");
        graph.addEdge("A", "C");
        graph.addEdge("B", "D");
        graph.addEdge("C", "D");
        return graph.snapshot();
    }

    @Test
    void exposesReverseIndex() {
        GraphSnapshot snapshot = diamond();

        assertThat(snapshot.dependents("D")).containsExactly("B", "C");
        assertThat(snapshot.dependents("A")).isEmpty();
        assertThat(snapshot.edgeCount()).isEqualTo(4);
    }

    @Test
    void transitiveDependenciesExcludeStartOutsideCycles() {
        GraphSnapshot snapshot = diamond();

        assertThat(snapshot.transitiveDependencies("A")).containsExactly("B", "C", "D");
        assertThat(snapshot.transitiveDependencies("D")).isEmpty();
    }

    @Test
    void closureKeepsOnlyReachableNodes() {
        GraphSnapshot closure = diamond().closureOf("B");

        assertThat(closure.keys()).containsExactly("B", "D");
        assertThat(closure.edgeCount()).isEqualTo(1);
    }

    @Test
    void snapshotIsNotAffectedByLaterMutation() {
        DependencyGraph graph = new DependencyGraph();
        graph.addRoot("A", "a");
        GraphSnapshot before = graph.snapshot();

        graph.addEdge("A", "B");

        assertThat(before.size()).isEqualTo(1);
        assertThat(before.dependencies("A")).isEmpty();
    }

    @Test
    void unknownKeyIsRejected() {
        assertThatThrownBy(() -> diamond().node("Z")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void filtersByState() {
        assertThat(diamond().nodesIn(NodeState.DISCOVERED)).hasSize(4);
        assertThat(diamond().nodesIn(NodeState.ERROR)).isEmpty();
    }
}
