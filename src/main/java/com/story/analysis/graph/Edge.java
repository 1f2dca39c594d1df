package com.story.analysis.graph;

import java.util.Objects;

/**
 * A directed, labelled edge between two nodes.
 *
 * <p>The label carries domain metadata (transition type, choice text, ...) and does not
 * take part in equality: two edges are equal when they connect the same endpoints.</p>
 *
 * @param from  source node
 * @param to    target node
 * @param label edge label, may be {@code null}
 * @param <N>   node type
 * @param <L>   label type
 */
public record Edge<N, L>(N from, N to, L label) {

    public Edge {
        Objects.requireNonNull(from, "from is required");
        Objects.requireNonNull(to, "to is required");
    }

    /**
     * Creates an edge with the given endpoints and label.
     */
    public static <N, L> Edge<N, L> of(N from, N to, L label) {
        return new Edge<>(from, to, label);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Edge<?, ?> that)) return false;
        return from.equals(that.from) && to.equals(that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(from, to);
    }

    @Override
    public String toString() {
        return from + " -> " + to + (label != null ? " [" + label + "]" : "");
    }
}
