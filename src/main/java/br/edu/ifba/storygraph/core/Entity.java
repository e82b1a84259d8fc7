package br.edu.ifba.storygraph.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named narrative element (character, location, object...) tracked across scenes.
 *
 * <p>Instances are immutable. The graph replaces the stored instance on every merge or edit.</p>
 *
 * <p>{@link #getAttributes()} is an open extension point: keys are optional and values are
 * untyped scalars or lists, so consumers must not assume any key is present.</p>
 */
public final class Entity {

    @JsonProperty("id")
    @NotNull
    private final String id;

    @JsonProperty("name")
    @NotNull
    private final String name;

    @JsonProperty("type")
    @NotNull
    private final EntityType type;

    @JsonProperty("description")
    @NotNull
    private final String description;

    @JsonProperty("aliases")
    @NotNull
    private final Set<String> aliases;

    @JsonProperty("attributes")
    @NotNull
    private final Map<String, Object> attributes;

    @JsonProperty("first_appearance")
    @Nullable
    private final String firstAppearance;

    @JsonProperty("appearances")
    @NotNull
    private final List<String> appearances;

    @JsonProperty("mention_count")
    private final int mentionCount;

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
    public Entity(
            @JsonProperty("id") @NotNull String id,
            @JsonProperty("name") @NotNull String name,
            @JsonProperty("type") @NotNull EntityType type,
            @JsonProperty("description") @Nullable String description,
            @JsonProperty("aliases") @Nullable Collection<String> aliases,
            @JsonProperty("attributes") @Nullable Map<String, Object> attributes,
            @JsonProperty("first_appearance") @Nullable String firstAppearance,
            @JsonProperty("appearances") @Nullable List<String> appearances,
            @JsonProperty("mention_count") int mentionCount,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("verified") boolean verified,
            @JsonProperty("created_at") @Nullable Instant createdAt,
            @JsonProperty("updated_at") @Nullable Instant updatedAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be in [0.0, 1.0], got: " + confidence);
        }
        if (mentionCount < 0) {
            throw new IllegalArgumentException("mentionCount must be >= 0, got: " + mentionCount);
        }
        this.description = description != null ? description : "";
        this.aliases = aliases != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(aliases))
            : Collections.emptySet();
        this.attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
        this.firstAppearance = firstAppearance;
        this.appearances = appearances != null
            ? Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(appearances)))
            : Collections.emptyList();
        this.mentionCount = mentionCount;
        this.confidence = confidence;
        this.verified = verified;
        Instant now = Instant.now();
        this.createdAt = createdAt != null ? createdAt : now;
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
    }

    @NotNull
    public String getId() {
        return id;
    }

    @NotNull
    public String getName() {
        return name;
    }

    @NotNull
    public EntityType getType() {
        return type;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @NotNull
    public Set<String> getAliases() {
        return aliases;
    }

    @NotNull
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Nullable
    public String getFirstAppearance() {
        return firstAppearance;
    }

    @NotNull
    public List<String> getAppearances() {
        return appearances;
    }

    public int getMentionCount() {
        return mentionCount;
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
     * Checks the name and every alias, ignoring case.
     */
    public boolean isKnownAs(@NotNull String candidate) {
        if (name.equalsIgnoreCase(candidate)) {
            return true;
        }
        for (String alias : aliases) {
            if (alias.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Merges a re-extracted record for the same id into this one.
     *
     * <ul>
     *   <li>attributes: per-key last-write-wins (incoming overwrites)</li>
     *   <li>aliases: union</li>
     *   <li>appearances: incoming scene references not yet present are appended, and
     *       {@code mentionCount} grows by one per appended reference</li>
     *   <li>description: the longer non-blank one</li>
     *   <li>type and first appearance: existing values are kept</li>
     *   <li>confidence: max; verified: sticky</li>
     * </ul>
     *
     * @param incoming record with the same id
     * @param now timestamp for {@code updatedAt}
     * @return merged entity
     */
    @NotNull
    public Entity mergeWith(@NotNull Entity incoming, @NotNull Instant now) {
        Objects.requireNonNull(incoming, "incoming must not be null");
        if (!id.equals(incoming.id)) {
            throw new IllegalArgumentException("Cannot merge entity " + incoming.id + " into " + id);
        }

        Map<String, Object> mergedAttributes = new LinkedHashMap<>(attributes);
        mergedAttributes.putAll(incoming.attributes);

        Set<String> mergedAliases = new LinkedHashSet<>(aliases);
        for (String alias : incoming.aliases) {
            if (!alias.equalsIgnoreCase(name)) {
                mergedAliases.add(alias);
            }
        }
        if (!incoming.name.equalsIgnoreCase(name)) {
            mergedAliases.add(incoming.name);
        }

        List<String> mergedAppearances = new ArrayList<>(appearances);
        int appended = 0;
        for (String sceneId : incoming.appearances) {
            if (!mergedAppearances.contains(sceneId)) {
                mergedAppearances.add(sceneId);
                appended++;
            }
        }

        String mergedDescription = description;
        if (description.isBlank() || incoming.description.length() > description.length()) {
            mergedDescription = incoming.description.isBlank() ? description : incoming.description;
        }

        String mergedFirst = firstAppearance != null ? firstAppearance : incoming.firstAppearance;
        if (mergedFirst == null && !mergedAppearances.isEmpty()) {
            mergedFirst = mergedAppearances.get(0);
        }

        return new Entity(
            id,
            name,
            type,
            mergedDescription,
            mergedAliases,
            mergedAttributes,
            mergedFirst,
            mergedAppearances,
            mentionCount + appended,
            Math.max(confidence, incoming.confidence),
            verified || incoming.verified,
            createdAt,
            now);
    }

    @NotNull
    public Builder toBuilder() {
        return new Builder()
            .id(id)
            .name(name)
            .type(type)
            .description(description)
            .aliases(aliases)
            .attributes(attributes)
            .firstAppearance(firstAppearance)
            .appearances(appearances)
            .mentionCount(mentionCount)
            .confidence(confidence)
            .verified(verified)
            .createdAt(createdAt)
            .updatedAt(updatedAt);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        Entity other = (Entity) obj;
        return mentionCount == other.mentionCount &&
               Double.compare(confidence, other.confidence) == 0 &&
               verified == other.verified &&
               id.equals(other.id) &&
               name.equals(other.name) &&
               type == other.type &&
               description.equals(other.description) &&
               aliases.equals(other.aliases) &&
               attributes.equals(other.attributes) &&
               Objects.equals(firstAppearance, other.firstAppearance) &&
               appearances.equals(other.appearances);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, type, description, aliases, attributes, firstAppearance,
            appearances, mentionCount, confidence, verified);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type=" + type +
                ", mentionCount=" + mentionCount +
                ", appearances=" + appearances +
                ", confidence=" + confidence +
                ", verified=" + verified +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for Entity instances. The id defaults to {@link EntityIds#fromName(String)}.
     */
    public static class Builder {
        private String id;
        private String name;
        private EntityType type;
        private String description = "";
        private Set<String> aliases = new LinkedHashSet<>();
        private Map<String, Object> attributes = new LinkedHashMap<>();
        private String firstAppearance;
        private List<String> appearances = new ArrayList<>();
        private int mentionCount;
        private double confidence = 1.0;
        private boolean verified;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(@Nullable String id) {
            this.id = id;
            return this;
        }

        public Builder name(@NotNull String name) {
            this.name = name;
            return this;
        }

        public Builder type(@NotNull EntityType type) {
            this.type = type;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description != null ? description : "";
            return this;
        }

        public Builder aliases(@Nullable Collection<String> aliases) {
            this.aliases = aliases != null ? new LinkedHashSet<>(aliases) : new LinkedHashSet<>();
            return this;
        }

        public Builder alias(@NotNull String alias) {
            this.aliases.add(alias);
            return this;
        }

        public Builder attributes(@Nullable Map<String, Object> attributes) {
            this.attributes = attributes != null ? new LinkedHashMap<>(attributes) : new LinkedHashMap<>();
            return this;
        }

        public Builder attribute(@NotNull String key, @Nullable Object value) {
            this.attributes.put(key, value);
            return this;
        }

        public Builder firstAppearance(@Nullable String firstAppearance) {
            this.firstAppearance = firstAppearance;
            return this;
        }

        public Builder appearances(@Nullable List<String> appearances) {
            this.appearances = appearances != null ? new ArrayList<>(appearances) : new ArrayList<>();
            return this;
        }

        /**
         * Records the entity as seen in a scene: sets the first appearance when unset and
         * counts one mention.
         */
        public Builder seenIn(@NotNull String sceneId) {
            if (firstAppearance == null) {
                firstAppearance = sceneId;
            }
            if (!appearances.contains(sceneId)) {
                appearances.add(sceneId);
                mentionCount++;
            }
            return this;
        }

        public Builder mentionCount(int mentionCount) {
            this.mentionCount = mentionCount;
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

        public Entity build() {
            Objects.requireNonNull(name, "name must not be null");
            String resolvedId = id != null ? id : EntityIds.fromName(name);
            return new Entity(resolvedId, name, type, description, aliases, attributes, firstAppearance,
                appearances, mentionCount, confidence, verified, createdAt, updatedAt);
        }
    }
}
