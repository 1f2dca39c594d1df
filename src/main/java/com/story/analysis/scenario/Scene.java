package com.story.analysis.scenario;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A scene of a scenario: narrative content, at most one linear successor and any number of branches.
 *
 * <p>The entity annotations record which narrative entities (characters, items, locations)
 * the scene introduces, removes and refers to. They are produced by the authoring layer
 * or an external classifier and are read-only input to the analyses.</p>
 */
@JsonDeserialize(builder = Scene.Builder.class)
public final class Scene {

    private final String id;
    private final String title;
    private final String content;
    private final SceneType type;
    private final String nextSceneId;
    private final List<Branch> branches;
    private final Set<String> introducedEntities;
    private final Set<String> removedEntities;
    private final Set<String> referencedEntities;

    private Scene(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.title = builder.title != null ? builder.title : "";
        this.content = builder.content != null ? builder.content : "";
        this.type = builder.type != null ? builder.type : SceneType.STANDARD;
        this.nextSceneId = builder.nextSceneId != null && !builder.nextSceneId.isBlank() ? builder.nextSceneId : null;
        this.branches = List.copyOf(builder.branches);
        this.introducedEntities = Set.copyOf(builder.introducedEntities);
        this.removedEntities = Set.copyOf(builder.removedEntities);
        this.referencedEntities = Set.copyOf(builder.referencedEntities);
    }

    public String getId() {
        return id;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public SceneType getType() {
        return type;
    }

    /**
     * Returns the linear next scene, or {@code null} if there is none.
     */
    public String getNextSceneId() {
        return nextSceneId;
    }

    public List<Branch> getBranches() {
        return branches;
    }

    public Set<String> getIntroducedEntities() {
        return introducedEntities;
    }

    public Set<String> getRemovedEntities() {
        return removedEntities;
    }

    public Set<String> getReferencedEntities() {
        return referencedEntities;
    }

    /**
     * Returns true if the scene leads anywhere, through its linear link or a branch.
     */
    public boolean hasSuccessor() {
        if (nextSceneId != null) {
            return true;
        }
        for (Branch branch : branches) {
            if (branch.hasTarget()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every scene id this scene points to, linear link first, in declaration order.
     */
    public List<String> targetSceneIds() {
        List<String> targets = new ArrayList<>();
        if (nextSceneId != null) {
            targets.add(nextSceneId);
        }
        for (Branch branch : branches) {
            if (branch.hasTarget()) {
                targets.add(branch.nextSceneId());
            }
        }
        return targets;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Scene scene = (Scene) o;
        return Objects.equals(id, scene.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Scene{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", next='" + nextSceneId + '\'' +
                ", branches=" + branches.size() +
                '}';
    }

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    @JsonPOJOBuilder(withPrefix = "")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Builder {
        private String id;
        private String title;
        private String content;
        private SceneType type;
        private String nextSceneId;
        private final List<Branch> branches = new ArrayList<>();
        private final Set<String> introducedEntities = new LinkedHashSet<>();
        private final Set<String> removedEntities = new LinkedHashSet<>();
        private final Set<String> referencedEntities = new LinkedHashSet<>();

        @JsonProperty("id")
        public Builder id(String id) {
            this.id = id;
            return this;
        }

        @JsonProperty("title")
        public Builder title(String title) {
            this.title = title;
            return this;
        }

        @JsonProperty("content")
        public Builder content(String content) {
            this.content = content;
            return this;
        }

        @JsonProperty("type")
        public Builder type(SceneType type) {
            this.type = type;
            return this;
        }

        @JsonProperty("next_scene_id")
        public Builder nextSceneId(String nextSceneId) {
            this.nextSceneId = nextSceneId;
            return this;
        }

        @JsonProperty("branches")
        public Builder branches(Collection<Branch> branches) {
            this.branches.clear();
            if (branches != null) {
                this.branches.addAll(branches);
            }
            return this;
        }

        public Builder branch(String choice, String nextSceneId) {
            this.branches.add(new Branch(choice, nextSceneId));
            return this;
        }

        @JsonProperty("introduced_entities")
        public Builder introducedEntities(Collection<String> entities) {
            replace(introducedEntities, entities);
            return this;
        }

        public Builder introduces(String... entities) {
            introducedEntities.addAll(List.of(entities));
            return this;
        }

        @JsonProperty("removed_entities")
        public Builder removedEntities(Collection<String> entities) {
            replace(removedEntities, entities);
            return this;
        }

        public Builder removes(String... entities) {
            removedEntities.addAll(List.of(entities));
            return this;
        }

        @JsonProperty("referenced_entities")
        public Builder referencedEntities(Collection<String> entities) {
            replace(referencedEntities, entities);
            return this;
        }

        public Builder references(String... entities) {
            referencedEntities.addAll(List.of(entities));
            return this;
        }

        public Scene build() {
            return new Scene(this);
        }

        private static void replace(Set<String> target, Collection<String> values) {
            target.clear();
            if (values != null) {
                target.addAll(values);
            }
        }
    }
}
