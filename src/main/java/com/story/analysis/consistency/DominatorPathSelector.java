package com.story.analysis.consistency;

import com.story.analysis.graph.DirectedGraph;
import com.story.analysis.graph.Dominators;
import com.story.analysis.graph.Edge;
import com.story.analysis.graph.PathAlgorithms;
import com.story.analysis.scenario.Scenario;
import com.story.analysis.scenario.SceneTransition;
import com.story.analysis.scenario.ScenarioGraphBuilder;
import com.story.analysis.statespace.FrontierMergedGraph;
import com.story.analysis.statespace.StateNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Chooses a bounded set of representative paths to hand to a path evaluator, and answers
 * dominator questions about a scenario's scene graph.
 *
 * <p>Representative paths come from the frontier-merged state graph: paths from the initial
 * state node to terminal nodes are enumerated (at most {@code maxPaths}), compressed by
 * shared suffixes so a suffix already covered by an earlier path is not evaluated again,
 * and mapped back to scene ids. Paths with identical scene sequences are reported once.</p>
 */
public class DominatorPathSelector {
    private static final Logger log = LoggerFactory.getLogger(DominatorPathSelector.class);

    private final ScenarioGraphBuilder graphBuilder;

    public DominatorPathSelector() {
        this(new ScenarioGraphBuilder());
    }

    public DominatorPathSelector(ScenarioGraphBuilder graphBuilder) {
        this.graphBuilder = Objects.requireNonNull(graphBuilder, "graphBuilder is required");
    }

    /**
     * Selects at most {@code maxPaths} representative scene paths from a merged state graph.
     */
    public <T, G> List<SelectedPath> selectPaths(FrontierMergedGraph<String, T, G, SceneTransition> stateGraph,
                                                 int maxPaths) {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths must be positive");
        }
        DirectedGraph<StateNode<String, G>, SceneTransition> graph = stateGraph.graph();

        List<List<StateNode<String, G>>> nodePaths = new ArrayList<>();
        for (List<StateNode<String, G>> path :
                PathAlgorithms.enumeratePaths(graph, stateGraph.initialNode(), stateGraph::isTerminal)) {
            nodePaths.add(path);
            if (nodePaths.size() >= maxPaths) {
                break;
            }
        }

        Map<List<String>, SelectedPath> selected = new LinkedHashMap<>();
        for (List<StateNode<String, G>> nodePath : PathAlgorithms.compressBySharedSuffixes(nodePaths)) {
            SelectedPath path = toScenePath(nodePath, PathAlgorithms.toEdgePath(graph, nodePath));
            selected.putIfAbsent(path.sceneIds(), path);
        }

        log.debug("paths.selected initial={} enumerated={} selected={}",
                stateGraph.initialNode(), nodePaths.size(), selected.size());
        return List.copyOf(selected.values());
    }

    /**
     * Immediate dominator of every scene reachable from the start scene, other than the start itself.
     */
    public Map<String, String> dominatorTree(Scenario scenario) {
        return dominators(scenario)
                .map(Dominators::immediateDominators)
                .orElse(Map.of());
    }

    /**
     * Scenes that every playthrough passes, in order, before reaching {@code targetSceneId};
     * the start scene first and the target last. Empty if the target is unreachable.
     */
    public List<String> dominatorPath(Scenario scenario, String targetSceneId) {
        return dominators(scenario)
                .map(d -> d.dominatorPath(targetSceneId))
                .orElse(List.of());
    }

    /**
     * Dominator path of every reachable ending scene, keyed by ending.
     */
    public Map<String, List<String>> dominatorPathsToEndings(Scenario scenario) {
        Optional<Dominators<String>> dominators = dominators(scenario);
        if (dominators.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String ending : graphBuilder.findEndingScenes(scenario)) {
            List<String> path = dominators.get().dominatorPath(ending);
            if (!path.isEmpty()) {
                result.put(ending, path);
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private Optional<Dominators<String>> dominators(Scenario scenario) {
        return graphBuilder.findStartScene(scenario)
                .map(start -> Dominators.compute(graphBuilder.build(scenario), start));
    }

    private static <G> SelectedPath toScenePath(List<StateNode<String, G>> nodePath,
                                                List<Edge<StateNode<String, G>, SceneTransition>> edgePath) {
        List<String> sceneIds = new ArrayList<>(nodePath.size());
        for (StateNode<String, G> node : nodePath) {
            sceneIds.add(node.sceneId());
        }
        List<SceneTransition> transitions = new ArrayList<>(edgePath.size());
        for (Edge<StateNode<String, G>, SceneTransition> edge : edgePath) {
            transitions.add(edge.label());
        }
        return new SelectedPath(sceneIds, transitions);
    }
}
