package com.story.analysis.scenario;

import com.story.analysis.dataflow.DataFlowNode;
import com.story.analysis.graph.DirectedGraph;
import com.story.analysis.graph.Edge;
import com.story.analysis.graph.PathAlgorithms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a scenario into a directed graph of scene transitions and answers structural questions about it.
 *
 * <p>Nodes are scene ids. Every declared scene is a node, even without transitions. A target id
 * that no scene declares still becomes a node, so dangling links stay visible in the graph.</p>
 */
public class ScenarioGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(ScenarioGraphBuilder.class);

    public static final int DEFAULT_MAX_PATHS = 100;

    /**
     * Builds the scene-transition graph: one edge per linear next-scene link and one per branch with a target.
     */
    public DirectedGraph<String, SceneTransition> build(Scenario scenario) {
        List<Edge<String, SceneTransition>> edges = new ArrayList<>();
        List<String> sceneIds = new ArrayList<>(scenario.scenes().size());

        for (Scene scene : scenario.scenes()) {
            sceneIds.add(scene.getId());

            if (scene.getNextSceneId() != null) {
                edges.add(Edge.of(scene.getId(), scene.getNextSceneId(),
                        SceneTransition.linear(scene.getId(), scene.getNextSceneId())));
            }
            for (Branch branch : scene.getBranches()) {
                if (!branch.hasTarget()) {
                    continue;
                }
                edges.add(Edge.of(scene.getId(), branch.nextSceneId(),
                        SceneTransition.branch(scene.getId(), branch.nextSceneId(), branch.choice())));
            }
        }

        DirectedGraph<String, SceneTransition> graph = DirectedGraph.fromEdges(edges, sceneIds);
        log.debug("scenario.graph.built scenarioId={} nodes={} edges={}",
                scenario.id(), graph.nodeCount(), graph.edgeCount());
        return graph;
    }

    /**
     * Finds the start scene: the first declared scene that no scene targets.
     * Falls back to the first declared scene when every scene is targeted (e.g. a cyclic scenario).
     * This is a heuristic: with several untargeted scenes the earliest one wins.
     *
     * @return the start scene id, or empty for a scenario without scenes
     */
    public Optional<String> findStartScene(Scenario scenario) {
        if (scenario.scenes().isEmpty()) {
            return Optional.empty();
        }

        Set<String> allTargets = new HashSet<>();
        for (Scene scene : scenario.scenes()) {
            allTargets.addAll(scene.targetSceneIds());
        }
        for (Scene scene : scenario.scenes()) {
            if (!allTargets.contains(scene.getId())) {
                return Optional.of(scene.getId());
            }
        }
        return Optional.of(scenario.scenes().get(0).getId());
    }

    /**
     * Finds every ending scene: scenes with neither a linear successor nor a branch with a target.
     */
    public List<String> findEndingScenes(Scenario scenario) {
        List<String> endings = new ArrayList<>();
        for (Scene scene : scenario.scenes()) {
            if (!scene.hasSuccessor()) {
                endings.add(scene.getId());
            }
        }
        return endings;
    }

    /**
     * Enumerates up to {@value #DEFAULT_MAX_PATHS} paths from the start scene to an ending.
     */
    public List<List<String>> enumerateAllPaths(Scenario scenario) {
        return enumerateAllPaths(scenario, DEFAULT_MAX_PATHS);
    }

    /**
     * Enumerates paths from the start scene to ending scenes.
     *
     * <p>Every returned path starts at {@link #findStartScene} and ends at a scene of
     * {@link #findEndingScenes}. Paths never revisit a scene. Parallel choices between the
     * same two scenes yield one path. Returns an empty list when the scenario has no start
     * or no ending.</p>
     *
     * @param maxPaths maximum number of paths returned
     */
    public List<List<String>> enumerateAllPaths(Scenario scenario, int maxPaths) {
        if (maxPaths <= 0) {
            throw new IllegalArgumentException("maxPaths must be positive");
        }
        Optional<String> start = findStartScene(scenario);
        Set<String> endings = new HashSet<>(findEndingScenes(scenario));
        if (start.isEmpty() || endings.isEmpty()) {
            return List.of();
        }

        DirectedGraph<String, SceneTransition> graph = build(scenario);
        Set<List<String>> paths = new LinkedHashSet<>();
        for (List<String> path : PathAlgorithms.enumeratePaths(graph, start.get(), endings::contains)) {
            if (endings.contains(path.get(path.size() - 1)) && paths.add(path)) {
                if (paths.size() >= maxPaths) {
                    break;
                }
            }
        }

        log.debug("scenario.paths.enumerated scenarioId={} start={} endings={} paths={}",
                scenario.id(), start.get(), endings.size(), paths.size());
        return new ArrayList<>(paths);
    }

    /**
     * Describes every declared scene as a dataflow node: links from the scene graph,
     * introductions and removals from the scene's entity annotations.
     */
    public Map<String, DataFlowNode<String, String>> toDataFlowNodes(Scenario scenario) {
        DirectedGraph<String, SceneTransition> graph = build(scenario);
        Map<String, DataFlowNode<String, String>> nodes = new LinkedHashMap<>();
        for (Scene scene : scenario.scenesById().values()) {
            nodes.put(scene.getId(), new DataFlowNode<>(
                    scene.getId(),
                    graph.predecessors(scene.getId()),
                    graph.successors(scene.getId()),
                    scene.getIntroducedEntities(),
                    scene.getRemovedEntities()));
        }
        return nodes;
    }
}
