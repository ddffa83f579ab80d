package com.entity.consolidation.core.model;

import com.entity.consolidation.rules.NameNormalizer;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a row in the {@code entities} table, loaded at the start of a run.
 * The normalized name is derived from the full name and never written back.
 */
public class Entity {
    private final long id;
    private final String fullName;
    private final String normalizedName;
    private final EntityType type;
    private final int mentions;
    private final Set<String> aliases;

    private Entity(Builder builder) {
        this.id = builder.id;
        this.fullName = builder.fullName;
        this.normalizedName = NameNormalizer.normalize(builder.fullName);
        this.type = builder.type != null ? builder.type : EntityType.UNKNOWN;
        this.mentions = builder.mentions;
        this.aliases = Collections.unmodifiableSet(new LinkedHashSet<>(builder.aliases));
    }

    public long getId() {
        return id;
    }

    public String getFullName() {
        return fullName;
    }

    public String getNormalizedName() {
        return normalizedName;
    }

    public EntityType getType() {
        return type;
    }

    public int getMentions() {
        return mentions;
    }

    public Set<String> getAliases() {
        return aliases;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return id == entity.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return "Entity{" +
                "id=" + id +
                ", fullName='" + fullName + '\'' +
                ", type=" + type +
                ", mentions=" + mentions +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long id;
        private String fullName;
        private EntityType type;
        private int mentions;
        private final Set<String> aliases = new LinkedHashSet<>();

        public Builder id(long id) {
            this.id = id;
            return this;
        }

        public Builder fullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        public Builder type(EntityType type) {
            this.type = type;
            return this;
        }

        public Builder mentions(int mentions) {
            this.mentions = mentions;
            return this;
        }

        public Builder aliases(Iterable<String> aliases) {
            if (aliases != null) {
                for (String alias : aliases) {
                    alias(alias);
                }
            }
            return this;
        }

        public Builder alias(String alias) {
            if (alias != null && !alias.isBlank()) {
                this.aliases.add(alias.trim());
            }
            return this;
        }

        public Entity build() {
            Objects.requireNonNull(fullName, "fullName is required");
            return new Entity(this);
        }
    }
}
