package com.story.analysis.dataflow;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A node of a forward dataflow problem: its links and the entities it introduces and removes.
 *
 * <p>An entity that is both introduced and removed at the same node counts as removed:
 * the transfer function applies removals after introductions.</p>
 *
 * @param id                 node identifier
 * @param predecessorIds     identifiers of the nodes with an edge into this node
 * @param successorIds       identifiers of the nodes this node has an edge to
 * @param introducedEntities entities introduced at this node
 * @param removedEntities    entities removed at this node
 * @param <N>                node identifier type
 * @param <E>                entity type
 */
public record DataFlowNode<N, E>(
        N id,
        List<N> predecessorIds,
        List<N> successorIds,
        Set<E> introducedEntities,
        Set<E> removedEntities
) {
    public DataFlowNode {
        Objects.requireNonNull(id, "id is required");
        predecessorIds = predecessorIds != null ? List.copyOf(predecessorIds) : List.of();
        successorIds = successorIds != null ? List.copyOf(successorIds) : List.of();
        introducedEntities = introducedEntities != null ? Set.copyOf(introducedEntities) : Set.of();
        removedEntities = removedEntities != null ? Set.copyOf(removedEntities) : Set.of();
    }

    /**
     * Applies this node's transfer function: {@code (incoming ∪ introduced) − removed}.
     *
     * @param incoming the set flowing into the node; not modified
     * @return a new mutable set
     */
    public Set<E> transfer(Set<E> incoming) {
        Set<E> result = new LinkedHashSet<>(incoming);
        result.addAll(introducedEntities);
        result.removeAll(removedEntities);
        return result;
    }
}
