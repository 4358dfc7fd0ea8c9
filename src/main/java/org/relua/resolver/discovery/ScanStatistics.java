package org.relua.resolver.discovery;

import org.relua.resolver.graph.GraphSnapshot;
import org.relua.resolver.graph.Linearization;
import org.relua.resolver.graph.ModuleRecord;
import org.relua.resolver.graph.NodeState;

/**
 * Counts consumed by the reporting collaborator.
 *
 * @param totalNodes           Files in the graph.
 * @param totalEdges           Distinct dependency edges.
 * @param unresolvedReferences References that matched no file.
 * @param dynamicReferences    References with a runtime-computed argument.
 * @param malformedReferences  Syntactically broken references.
 * @param errorNodes           Files that could not be read.
 * @param cycleGroups          Detected cycle groups.
 * @param maxDependencies      Largest out-degree.
 * @param minDependencies      Smallest out-degree.
 * @param averageDependencies  Mean out-degree.
 */
public record ScanStatistics(
        int totalNodes,
        int totalEdges,
        int unresolvedReferences,
        int dynamicReferences,
        int malformedReferences,
        int errorNodes,
        int cycleGroups,
        int maxDependencies,
        int minDependencies,
        double averageDependencies
) {

    public static ScanStatistics of(GraphSnapshot snapshot, Linearization linearization) {
        int dynamic = 0;
        int malformed = 0;
        int max = 0;
        int min = snapshot.size() == 0 ? 0 : Integer.MAX_VALUE;
        for (ModuleRecord node : snapshot.nodes()) {
            dynamic += node.dynamicReferences();
            malformed += node.malformedReferences();
            int degree = node.dependencies().size();
            max = Math.max(max, degree);
            min = Math.min(min, degree);
        }
        double average = snapshot.size() == 0 ? 0.0 : (double) snapshot.edgeCount() / snapshot.size();
        return new ScanStatistics(
                snapshot.size(),
                snapshot.edgeCount(),
                snapshot.unresolvedReferenceCount(),
                dynamic,
                malformed,
                snapshot.nodesIn(NodeState.ERROR).size(),
                linearization.cycles().size(),
                max,
                min,
                average);
    }
}
