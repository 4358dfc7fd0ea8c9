package org.relua.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;

import org.relua.cli.CommandLineInterface;
import org.relua.resolver.discovery.DependencyScanner;
import org.relua.resolver.discovery.DiscoveryOptions;
import org.relua.resolver.discovery.RestorationPlan;
import org.relua.resolver.discovery.RestorationUnit;
import org.relua.resolver.discovery.RootModuleException;
import org.relua.resolver.discovery.ScanStatistics;
import org.relua.resolver.graph.CycleGroup;
import org.relua.resolver.graph.NodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that discovers the modules reachable from a root file and prints the
 * order in which they should be restored.
 * <p>
 * Command-line options override the {@code relua.discovery} configuration block.
 */
@Command(
    name = "plan",
    description = "Discover require dependencies of a decompiled Lua file and print the restoration order"
)
public class PlanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlanCommand.class);

    @Parameters(index = "0", paramLabel = "ROOT_FILE", description = "The file restoration starts from")
    private Path rootFile;

    @Option(
        names = {"-s", "--search-root"},
        description = "Module search root, repeatable, in priority order (default: from configuration)"
    )
    private List<Path> searchRoots = new ArrayList<>();

    @Option(names = {"-w", "--workers"}, description = "Number of parallel file readers")
    private Integer workers;

    @Option(names = {"--max-depth"}, description = "Stop following references below this depth (0 = unlimited)")
    private Integer maxDepth;

    @Option(names = {"--json"}, description = "Print the plan as JSON")
    private boolean json;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!Files.isRegularFile(rootFile)) {
            err.println("Error: Root file not found: " + rootFile.toAbsolutePath());
            return 1;
        }

        try {
            DiscoveryOptions options = buildOptions();
            RestorationPlan plan = new DependencyScanner(options).scan(rootFile);
            if (json) {
                printJson(plan, out);
            } else {
                printText(plan, out);
            }
            out.flush();
            return 0;
        } catch (RootModuleException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log.error("Discovery failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (CancellationException e) {
            err.println("Discovery cancelled");
            return 130;
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: Invalid configuration: " + e.getMessage());
            return 1;
        }
    }

    private DiscoveryOptions buildOptions() {
        DiscoveryOptions options = DiscoveryOptions.fromConfig(parent.getConfig());
        if (!searchRoots.isEmpty()) {
            options = options.withSearchRoots(searchRoots);
        }
        if (workers != null) {
            options = options.withWorkers(workers);
        }
        if (maxDepth != null) {
            options = options.withMaxDepth(maxDepth);
        }
        return options;
    }

    private void printText(RestorationPlan plan, PrintWriter out) {
        out.println("Restoration order for " + plan.rootKey() + ":");
        int position = 1;
        for (RestorationUnit unit : plan.units()) {
            String marker = unit.state() == NodeState.RESOLVED ? "" : "  [" + unit.state() + "]";
            out.printf("  %3d. %s (%s)%s%n", position++, unit.moduleName(), unit.nodeKey(), marker);
        }

        if (!plan.cycles().isEmpty()) {
            out.println();
            out.println("Circular dependencies:");
            for (CycleGroup cycle : plan.cycles()) {
                out.println("  " + String.join(" -> ", cycle.examplePath()));
            }
        }

        ScanStatistics stats = plan.statistics();
        out.println();
        out.println("Modules:               " + stats.totalNodes());
        out.println("Dependencies:          " + stats.totalEdges());
        out.println("Unresolved references: " + stats.unresolvedReferences());
        out.println("Dynamic references:    " + stats.dynamicReferences());
        out.println("Malformed references:  " + stats.malformedReferences());
        out.println("Unreadable files:      " + stats.errorNodes());
        out.println("Cycle groups:          " + stats.cycleGroups());
        out.printf("Dependencies per file: max %d, min %d, avg %.2f%n",
                stats.maxDependencies(), stats.minDependencies(), stats.averageDependencies());
    }

    private void printJson(RestorationPlan plan, PrintWriter out) {
        List<UnitView> units = new ArrayList<>(plan.units().size());
        for (RestorationUnit unit : plan.units()) {
            units.add(new UnitView(unit.nodeKey(), unit.moduleName(), unit.state(), unit.resolvedDependencyKeys()));
        }
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        out.println(gson.toJson(new PlanView(plan.rootKey(), units, plan.cycles(), plan.statistics())));
    }

    // file contents are left out of the printed plan
    private record UnitView(String nodeKey, String moduleName, NodeState state, List<String> dependencies) {}

    private record PlanView(String rootKey, List<UnitView> order, List<CycleGroup> cycles, ScanStatistics statistics) {}
}
