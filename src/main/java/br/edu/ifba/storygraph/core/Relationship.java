package br.edu.ifba.storygraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A typed, directed, evidenced connection between two entities.
 *
 * <p>Identity is the triple (source, target, relation type); the same ordered pair may be
 * connected by several relation types.</p>
 */
public final class Relationship {

    @JsonProperty("source")
    @NotNull
    private final String sourceId;

    @JsonProperty("target")
    @NotNull
    private final String targetId;

    @JsonProperty("relation")
    @NotNull
    private final RelationType relationType;

    @JsonProperty("description")
    @NotNull
    private final String description;

    @JsonProperty("context")
    @NotNull
    private final List<String> context;

    @JsonProperty("scenes")
    @NotNull
    private final List<String> scenes;

    @JsonProperty("strength")
    private final double strength;

    @JsonProperty("valence")
    private final double valence;

    @JsonProperty("attributes")
    @NotNull
    private final Map<String, Object> attributes;

    @JsonProperty("start_scene")
    @Nullable
    private final String startScene;

    @JsonProperty("end_scene")
    @Nullable
    private final String endScene;

    @JsonProperty("confidence")
    private final double confidence;

    @JsonProperty("verified")
    private final boolean verified;

    @JsonProperty("created_at")
    @NotNull
    private final Instant createdAt;

    @JsonProperty("updated_at")
    @NotNull
    private final Instant updatedAt;

    @JsonCreator
    public Relationship(
            @JsonProperty("source") @NotNull String sourceId,
            @JsonProperty("target") @NotNull String targetId,
            @JsonProperty("relation") @NotNull RelationType relationType,
            @JsonProperty("description") @Nullable String description,
            @JsonProperty("context") @Nullable List<String> context,
            @JsonProperty("scenes") @Nullable List<String> scenes,
            @JsonProperty("strength") double strength,
            @JsonProperty("valence") double valence,
            @JsonProperty("attributes") @Nullable Map<String, Object> attributes,
            @JsonProperty("start_scene") @Nullable String startScene,
            @JsonProperty("end_scene") @Nullable String endScene,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("verified") boolean verified,
            @JsonProperty("created_at") @Nullable Instant createdAt,
            @JsonProperty("updated_at") @Nullable Instant updatedAt) {
        this.sourceId = Objects.requireNonNull(sourceId, "sourceId must not be null");
        this.targetId = Objects.requireNonNull(targetId, "targetId must not be null");
        this.relationType = Objects.requireNonNull(relationType, "relationType must not be null");
        if (strength < 0.0 || strength > 1.0) {
            throw new IllegalArgumentException("strength must be in [0.0, 1.0], got: " + strength);
        }
        if (valence < -1.0 || valence > 1.0) {
            throw new IllegalArgumentException("valence must be in [-1.0, 1.0], got: " + valence);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0], got: " + confidence);
        }
        this.description = description != null ? description : "";
        this.context = context != null
            ? Collections.unmodifiableList(new ArrayList<>(context))
            : Collections.emptyList();
        this.scenes = scenes != null
            ? Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(scenes)))
            : Collections.emptyList();
        this.strength = strength;
        this.valence = valence;
        this.attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
        this.startScene = startScene;
        this.endScene = endScene;
        this.confidence = confidence;
        this.verified = verified;
        Instant now = Instant.now();
        this.createdAt = createdAt != null ? createdAt : now;
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
    }

    @NotNull
    public String getSourceId() {
        return sourceId;
    }

    @NotNull
    public String getTargetId() {
        return targetId;
    }

    @NotNull
    public RelationType getRelationType() {
        return relationType;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @NotNull
    public List<String> getContext() {
        return context;
    }

    @NotNull
    public List<String> getScenes() {
        return scenes;
    }

    public double getStrength() {
        return strength;
    }

    public double getValence() {
        return valence;
    }

    @NotNull
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Nullable
    public String getStartScene() {
        return startScene;
    }

    @Nullable
    public String getEndScene() {
        return endScene;
    }

    public double getConfidence() {
        return confidence;
    }

    public boolean isVerified() {
        return verified;
    }

    @NotNull
    public Instant getCreatedAt() {
        return createdAt;
    }

    @NotNull
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * Identity triple used as the index key.
     */
    @NotNull
    public Key key() {
        return new Key(sourceId, targetId, relationType);
    }

    public boolean touches(@NotNull String entityId) {
        return sourceId.equals(entityId) || targetId.equals(entityId);
    }

    /**
     * Merges a re-extracted relationship with the same identity.
     * Evidence and scenes accumulate; strength and valence follow the latest extraction.
     */
    @NotNull
    public Relationship mergeWith(@NotNull Relationship incoming, @NotNull Instant now) {
        if (!key().equals(incoming.key())) {
            throw new IllegalArgumentException("Cannot merge relationship " + incoming.key() + " into " + key());
        }

        List<String> mergedContext = new ArrayList<>(context);
        for (String snippet : incoming.context) {
            if (!snippet.isBlank() && !mergedContext.contains(snippet)) {
                mergedContext.add(snippet);
            }
        }

        List<String> mergedScenes = new ArrayList<>(scenes);
        for (String sceneId : incoming.scenes) {
            if (!mergedScenes.contains(sceneId)) {
                mergedScenes.add(sceneId);
            }
        }

        Map<String, Object> mergedAttributes = new LinkedHashMap<>(attributes);
        mergedAttributes.putAll(incoming.attributes);

        String mergedDescription = incoming.description.length() > description.length()
            ? incoming.description
            : description;

        String mergedEnd = endScene;
        if (!incoming.scenes.isEmpty()) {
            mergedEnd = incoming.scenes.get(incoming.scenes.size() - 1);
        } else if (incoming.endScene != null) {
            mergedEnd = incoming.endScene;
        }

        return new Relationship(
            sourceId,
            targetId,
            relationType,
            mergedDescription,
            mergedContext,
            mergedScenes,
            incoming.strength,
            incoming.valence,
            mergedAttributes,
            startScene != null ? startScene : incoming.startScene,
            mergedEnd,
            Math.max(confidence, incoming.confidence),
            verified || incoming.verified,
            createdAt,
            now);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Relationship other = (Relationship) obj;
        return Double.compare(strength, other.strength) == 0 &&
               Double.compare(valence, other.valence) == 0 &&
               Double.compare(confidence, other.confidence) == 0 &&
               verified == other.verified &&
               sourceId.equals(other.sourceId) &&
               targetId.equals(other.targetId) &&
               relationType == other.relationType &&
               description.equals(other.description) &&
               context.equals(other.context) &&
               scenes.equals(other.scenes) &&
               attributes.equals(other.attributes) &&
               Objects.equals(startScene, other.startScene) &&
               Objects.equals(endScene, other.endScene);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sourceId, targetId, relationType, description, context, scenes, strength,
            valence, attributes, startScene, endScene, confidence, verified);
    }

    @Override
    public String toString() {
        return "Relationship{" + sourceId + " --[" + relationType.getValue() + "]--> " + targetId +
                ", strength=" + strength +
                ", valence=" + valence +
                ", scenes=" + scenes +
                '}';
    }

    /**
     * Identity triple of a relationship.
     */
    public record Key(@NotNull String sourceId, @NotNull String targetId, @NotNull RelationType relationType) {
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Relationship instances.
     */
    public static class Builder {
        private String sourceId;
        private String targetId;
        private RelationType relationType;
        private String description = "";
        private List<String> context = new ArrayList<>();
        private List<String> scenes = new ArrayList<>();
        private double strength = 1.0;
        private double valence = 0.0;
        private Map<String, Object> attributes = new LinkedHashMap<>();
        private String startScene;
        private String endScene;
        private double confidence = 1.0;
        private boolean verified;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder source(@NotNull String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder target(@NotNull String targetId) {
            this.targetId = targetId;
            return this;
        }

        public Builder relationType(@NotNull RelationType relationType) {
            this.relationType = relationType;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder context(@Nullable List<String> context) {
            this.context = context != null ? new ArrayList<>(context) : new ArrayList<>();
            return this;
        }

        public Builder evidence(@NotNull String snippet) {
            this.context.add(snippet);
            return this;
        }

        public Builder scenes(@Nullable List<String> scenes) {
            this.scenes = scenes != null ? new ArrayList<>(scenes) : new ArrayList<>();
            return this;
        }

        /**
         * Adds a scene reference and opens the temporal span on the first one.
         */
        public Builder seenIn(@NotNull String sceneId) {
            if (!scenes.contains(sceneId)) {
                scenes.add(sceneId);
            }
            if (startScene == null) {
                startScene = sceneId;
            }
            return this;
        }

        public Builder strength(double strength) {
            this.strength = strength;
            return this;
        }

        public Builder valence(double valence) {
            this.valence = valence;
            return this;
        }

        public Builder attributes(@Nullable Map<String, Object> attributes) {
            this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
            return this;
        }

        public Builder startScene(@Nullable String startScene) {
            this.startScene = startScene;
            return this;
        }

        public Builder endScene(@Nullable String endScene) {
            this.endScene = endScene;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder verified(boolean verified) {
            this.verified = verified;
            return this;
        }

        public Builder createdAt(@Nullable Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(@Nullable Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Relationship build() {
            return new Relationship(sourceId, targetId, relationType, description, context, scenes, strength,
                valence, attributes, startScene, endScene, confidence, verified, createdAt, updatedAt);
        }
    }
}
