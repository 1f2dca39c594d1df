package com.story.analysis.graph;

import java.util.Locale;
import java.util.Objects;

/**
 * Equality strategy for graph nodes, used when a graph is built.
 * The default is {@link #natural()}, which delegates to {@link Object#equals(Object)}.
 *
 * <p>A graph built with a non-natural equivalence stores one representative instance per
 * equivalence class and rewrites edge endpoints to that instance, so nodes returned by the
 * graph can be compared with plain {@code equals} afterwards.</p>
 *
 * @param <N> node type
 */
public interface NodeEquivalence<N> {

    boolean equivalent(N a, N b);

    int hash(N node);

    /**
     * Natural equality ({@code equals}/{@code hashCode}).
     */
    static <N> NodeEquivalence<N> natural() {
        @SuppressWarnings("unchecked")
        NodeEquivalence<N> natural = (NodeEquivalence<N>) Natural.INSTANCE;
        return natural;
    }

    /**
     * Case-insensitive equality for string identifiers.
     */
    static NodeEquivalence<String> ignoringCase() {
        return new NodeEquivalence<>() {
            @Override
            public boolean equivalent(String a, String b) {
                return a.equalsIgnoreCase(b);
            }

            @Override
            public int hash(String node) {
                return node.toLowerCase(Locale.ROOT).hashCode();
            }
        };
    }

    final class Natural implements NodeEquivalence<Object> {
        private static final Natural INSTANCE = new Natural();

        private Natural() {
        }

        @Override
        public boolean equivalent(Object a, Object b) {
            return Objects.equals(a, b);
        }

        @Override
        public int hash(Object node) {
            return Objects.hashCode(node);
        }
    }
}
