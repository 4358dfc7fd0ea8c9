package org.relua.resolver.discovery;

import org.relua.resolver.graph.CycleGroup;
import org.relua.resolver.graph.GraphSnapshot;
import org.relua.resolver.graph.Linearization;
import org.relua.resolver.graph.ModuleRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a discovery run: the files in processing order, the cycle report and the
 * summary counts.
 *
 * @param rootKey    Canonical path of the root file.
 * @param units      Files in processing order.
 * @param cycles     Detected cycle groups with an example path each.
 * @param statistics Counts for human-readable summaries.
 */
public record RestorationPlan(
        String rootKey,
        List<RestorationUnit> units,
        List<CycleGroup> cycles,
        ScanStatistics statistics
) {

    public RestorationPlan {
        units = List.copyOf(units);
        cycles = List.copyOf(cycles);
    }

    static RestorationPlan of(String rootKey, GraphSnapshot snapshot, Linearization linearization) {
        List<RestorationUnit> units = new ArrayList<>(linearization.order().size());
        for (String key : linearization.order()) {
            ModuleRecord node = snapshot.node(key);
            units.add(new RestorationUnit(key, node.moduleName(), node.state(), node.content(), node.dependencies()));
        }
        return new RestorationPlan(rootKey, units, linearization.cycles(),
                ScanStatistics.of(snapshot, linearization));
    }

    /** Node keys in processing order. */
    public List<String> order() {
        return units.stream().map(RestorationUnit::nodeKey).toList();
    }
}
