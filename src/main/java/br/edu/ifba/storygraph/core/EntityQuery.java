package br.edu.ifba.storygraph.core;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Filters for {@link KnowledgeGraph#queryEntities(EntityQuery)}. Every filter is optional.
 *
 * @param type restrict to one entity type
 * @param minMentions minimum mention count (0 disables)
 * @param verifiedOnly only human-verified entities
 * @param attributeFilters exact-match filters on attribute values
 */
public record EntityQuery(
    @Nullable EntityType type,
    int minMentions,
    boolean verifiedOnly,
    @NotNull Map<String, Object> attributeFilters
) {
    public static final EntityQuery ALL = new EntityQuery(null, 0, false, Map.of());

    public EntityQuery {
        attributeFilters = attributeFilters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributeFilters))
            : Map.of();
    }

    public static EntityQuery ofType(@NotNull EntityType type) {
        return new EntityQuery(type, 0, false, Map.of());
    }

    public boolean matches(@NotNull Entity entity) {
        if (type != null && entity.getType() != type) {
            return false;
        }
        if (entity.getMentionCount() < minMentions) {
            return false;
        }
        if (verifiedOnly && !entity.isVerified()) {
            return false;
        }
        for (Map.Entry<String, Object> filter : attributeFilters.entrySet()) {
            if (!Objects.equals(entity.getAttributes().get(filter.getKey()), filter.getValue())) {
                return false;
            }
        }
        return true;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private EntityType type;
        private int minMentions;
        private boolean verifiedOnly;
        private final Map<String, Object> attributeFilters = new LinkedHashMap<>();

        public Builder type(@Nullable EntityType type) {
            this.type = type;
            return this;
        }

        public Builder minMentions(int minMentions) {
            this.minMentions = minMentions;
            return this;
        }

        public Builder verifiedOnly(boolean verifiedOnly) {
            this.verifiedOnly = verifiedOnly;
            return this;
        }

        public Builder attribute(@NotNull String key, @Nullable Object value) {
            this.attributeFilters.put(key, value);
            return this;
        }

        public EntityQuery build() {
            return new EntityQuery(type, minMentions, verifiedOnly, attributeFilters);
        }
    }
}
