package com.story.analysis.consistency;

import com.story.analysis.scenario.Scene;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Concrete narrative state used when exploring a scenario's state space: which entities are
 * present, which have been removed, and how many scenes have been played.
 *
 * <p>The {@link #signature()} keeps only the two entity sets. Playthroughs that reach the same
 * scene with the same entities merge, however long they took to get there.</p>
 */
public final class EntityState {

    private static final EntityState INITIAL = new EntityState(Set.of(), Set.of(), 0);

    private final Set<String> presentEntities;
    private final Set<String> removedEntities;
    private final int scenesVisited;

    private EntityState(Set<String> presentEntities, Set<String> removedEntities, int scenesVisited) {
        this.presentEntities = presentEntities;
        this.removedEntities = removedEntities;
        this.scenesVisited = scenesVisited;
    }

    /**
     * The state before any scene has been played.
     */
    public static EntityState initial() {
        return INITIAL;
    }

    /**
     * Returns the state after playing {@code scene}: its introductions are added, then its removals applied.
     */
    public EntityState enter(Scene scene) {
        Set<String> present = new TreeSet<>(presentEntities);
        present.addAll(scene.getIntroducedEntities());
        present.removeAll(scene.getRemovedEntities());

        Set<String> removed = new TreeSet<>(removedEntities);
        removed.removeAll(scene.getIntroducedEntities());
        removed.addAll(scene.getRemovedEntities());

        return new EntityState(
                Collections.unmodifiableSet(present),
                Collections.unmodifiableSet(removed),
                scenesVisited + 1);
    }

    public Set<String> getPresentEntities() {
        return presentEntities;
    }

    public Set<String> getRemovedEntities() {
        return removedEntities;
    }

    public int getScenesVisited() {
        return scenesVisited;
    }

    public boolean isPresent(String entity) {
        return presentEntities.contains(entity);
    }

    /**
     * Abstraction used for frontier merging.
     */
    public Signature signature() {
        return new Signature(presentEntities, removedEntities);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EntityState that = (EntityState) o;
        return scenesVisited == that.scenesVisited
                && presentEntities.equals(that.presentEntities)
                && removedEntities.equals(that.removedEntities);
    }

    @Override
    public int hashCode() {
        return Objects.hash(presentEntities, removedEntities, scenesVisited);
    }

    @Override
    public String toString() {
        return "EntityState{" +
                "present=" + presentEntities +
                ", removed=" + removedEntities +
                ", scenesVisited=" + scenesVisited +
                '}';
    }

    /**
     * Merge key of an {@link EntityState}.
     *
     * @param presentEntities entities present
     * @param removedEntities entities removed
     */
    public record Signature(Set<String> presentEntities, Set<String> removedEntities) {
        public Signature {
            presentEntities = Set.copyOf(presentEntities);
            removedEntities = Set.copyOf(removedEntities);
        }

        @Override
        public String toString() {
            return "+" + new TreeSet<>(presentEntities) + "-" + new TreeSet<>(removedEntities);
        }
    }
}
