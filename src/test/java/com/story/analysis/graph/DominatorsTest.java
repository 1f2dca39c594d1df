package com.story.analysis.graph;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Dominators Tests")
class DominatorsTest {

    private DirectedGraph<String, String> graph;
    private Dominators<String> dominators;

    @BeforeEach
    void setUp() {
        // A -> {B, C} -> D -> E -> B (loop back), F unreachable
        List<Edge<String, String>> edges = new ArrayList<>();
        for (String pair : List.of("A>B", "A>C", "B>D", "C>D", "D>E", "E>B")) {
            String[] ends = pair.split(">");
            edges.add(Edge.of(ends[0], ends[1], pair));
        }
        graph = DirectedGraph.fromEdges(edges, List.of("F"));
        dominators = Dominators.compute(graph, "A");
    }

    @Test
    @DisplayName("Immediate dominators follow the join points")
    void immediateDominators() {
        assertEquals(Map.of("B", "A", "C", "A", "D", "A", "E", "D"), dominators.immediateDominators());
        assertEquals(Optional.empty(), dominators.immediateDominator("A"));
        assertEquals(Optional.of("D"), dominators.immediateDominator("E"));
    }

    @Test
    @DisplayName("Dominator path runs from the start to the target")
    void dominatorPath() {
        assertEquals(List.of("A", "D", "E"), dominators.dominatorPath("E"));
        assertEquals(List.of("A"), dominators.dominatorPath("A"));
    }

    @Test
    @DisplayName("Dominance is reflexive and respects alternative routes")
    void dominates() {
        assertTrue(dominators.dominates("A", "E"));
        assertTrue(dominators.dominates("D", "E"));
        assertTrue(dominators.dominates("E", "E"));
        assertFalse(dominators.dominates("B", "D"));
        assertFalse(dominators.dominates("E", "D"));
    }

    @Test
    @DisplayName("Unreachable nodes have no dominators")
    void unreachable() {
        assertFalse(dominators.isReachable("F"));
        assertTrue(dominators.dominatorPath("F").isEmpty());
        assertEquals(Optional.empty(), dominators.immediateDominator("F"));
        assertFalse(dominators.dominates("A", "F"));
    }

    @Test
    @DisplayName("Start node must belong to the graph")
    void unknownStart() {
        assertThrows(IllegalArgumentException.class, () -> Dominators.compute(graph, "Z"));
    }
}
