package com.story.analysis.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathAlgorithms Tests")
class PathAlgorithmsTest {

    private static <N> List<List<N>> collect(Iterable<List<N>> paths) {
        List<List<N>> result = new ArrayList<>();
        paths.forEach(result::add);
        return result;
    }

    private static DirectedGraph<String, String> graph(String... pairs) {
        List<Edge<String, String>> edges = new ArrayList<>();
        for (String pair : pairs) {
            String[] ends = pair.split(">");
            edges.add(Edge.of(ends[0], ends[1], pair));
        }
        return DirectedGraph.fromEdges(edges);
    }

    @Nested
    @DisplayName("enumeratePaths")
    class Enumerate {

        @Test
        @DisplayName("Enumerates every path to a sink in depth-first order")
        void pathsToSinks() {
            DirectedGraph<String, String> g = graph("A>B", "B>C", "B>D");

            assertEquals(List.of(List.of("A", "B", "C"), List.of("A", "B", "D")),
                    collect(PathAlgorithms.enumeratePaths(g, "A")));
        }

        @Test
        @DisplayName("Cycles are not re-entered and non-terminal dead ends are dropped")
        void cyclesTerminate() {
            DirectedGraph<String, String> g = graph("A>B", "B>A", "B>C");

            assertEquals(List.of(List.of("A", "B", "C")),
                    collect(PathAlgorithms.enumeratePaths(g, "A")));
        }

        @Test
        @DisplayName("Terminal predicate stops paths early")
        void terminalPredicate() {
            DirectedGraph<String, String> g = graph("A>B", "B>C", "C>D");

            assertEquals(List.of(List.of("A", "B")),
                    collect(PathAlgorithms.enumeratePaths(g, "A", "B"::equals)));
        }

        @Test
        @DisplayName("Depth limit reports truncated paths")
        void depthLimit() {
            DirectedGraph<String, String> g = graph("A>B", "B>C", "C>D");

            assertEquals(List.of(List.of("A", "B")),
                    collect(PathAlgorithms.enumeratePaths(g, "A", null, 1)));
            assertEquals(List.of(List.of("A")),
                    collect(PathAlgorithms.enumeratePaths(g, "A", null, 0)));
        }

        @Test
        @DisplayName("Enumeration is lazy and can be stopped after a bounded number of paths")
        void lazy() {
            // 2^10 paths through a chain of diamonds
            List<String> pairs = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                pairs.add("n" + i + ">l" + i);
                pairs.add("n" + i + ">r" + i);
                pairs.add("l" + i + ">n" + (i + 1));
                pairs.add("r" + i + ">n" + (i + 1));
            }
            DirectedGraph<String, String> g = graph(pairs.toArray(new String[0]));

            Iterator<List<String>> it = PathAlgorithms.enumeratePaths(g, "n0").iterator();
            assertTrue(it.hasNext());
            assertEquals("n10", it.next().get(20));
            assertEquals(1024, collect(PathAlgorithms.enumeratePaths(g, "n0")).size());
        }

        @Test
        @DisplayName("Invalid depth is rejected")
        void invalidDepth() {
            DirectedGraph<String, String> g = graph("A>B");

            assertThrows(IllegalArgumentException.class,
                    () -> PathAlgorithms.enumeratePaths(g, "A", null, -2));
        }
    }

    @Nested
    @DisplayName("compressBySharedSuffixes")
    class Compress {

        @Test
        @DisplayName("Later path sharing a suffix with an earlier one is cut after the join point")
        void sharedSuffixTrimmed() {
            List<List<String>> paths = List.of(
                    List.of("A", "B", "D", "E"),
                    List.of("A", "C", "D", "E"));

            List<List<String>> compressed = PathAlgorithms.compressBySharedSuffixes(paths);

            assertEquals(List.of(
                    List.of("A", "B", "D", "E"),
                    List.of("A", "C", "D")), compressed);
        }

        @Test
        @DisplayName("Paths without shared suffixes are unchanged")
        void disjointSuffixes() {
            List<List<String>> paths = List.of(
                    List.of("A", "B", "C"),
                    List.of("A", "B", "D"));

            assertEquals(paths, PathAlgorithms.compressBySharedSuffixes(paths));
        }

        @Test
        @DisplayName("Duplicate paths are reported once")
        void duplicates() {
            List<List<String>> paths = List.of(List.of("A", "B"), List.of("A", "B"));

            assertEquals(List.of(List.of("A", "B")), PathAlgorithms.compressBySharedSuffixes(paths));
        }

        @Test
        @DisplayName("Empty input gives empty output")
        void empty() {
            assertTrue(PathAlgorithms.compressBySharedSuffixes(List.<List<String>>of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Edge paths")
    class EdgePaths {

        @Test
        @DisplayName("Node path maps to the edges it traverses")
        void toEdgePath() {
            DirectedGraph<String, String> g = graph("A>B", "B>C");

            List<Edge<String, String>> edges = PathAlgorithms.toEdgePath(g, List.of("A", "B", "C"));

            assertEquals(List.of("A>B", "B>C"), edges.stream().map(Edge::label).toList());
            assertTrue(PathAlgorithms.toEdgePath(g, List.of("A")).isEmpty());
        }

        @Test
        @DisplayName("Missing edge is reported")
        void missingEdge() {
            DirectedGraph<String, String> g = graph("A>B", "B>C");

            assertThrows(IllegalStateException.class, () -> PathAlgorithms.toEdgePath(g, List.of("A", "C")));
        }

        @Test
        @DisplayName("Graph paths are compressed and mapped to edges")
        void compressGraphPaths() {
            DirectedGraph<String, String> g = graph("A>B", "A>C", "B>D", "C>D", "D>E");

            List<List<Edge<String, String>>> edgePaths = PathAlgorithms.compressGraphPathsToEdgePaths(
                    g, "A", null, PathAlgorithms.UNBOUNDED);

            assertEquals(2, edgePaths.size());
            assertEquals(List.of("A>B", "B>D", "D>E"), edgePaths.get(0).stream().map(Edge::label).toList());
            assertEquals(List.of("A>C", "C>D"), edgePaths.get(1).stream().map(Edge::label).toList());
        }
    }
}
