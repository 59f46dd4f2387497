package com.lexkb.search.document;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class SearchDocument {
    private final String id;
    private final String entityId;
    private final EntityType entityType;
    private final String title;
    private final String content;
    private final String summary;
    private final Set<String> tags;
    private final Set<String> categories;
    private final String language;
    private final String accessLevel;
    private final String authorId;
    private final Map<String, MetadataValue> metadata;
    private final Instant createdAt;
    private final Instant updatedAt;

    private SearchDocument(Builder builder) {
        this.id = builder.id;
        this.entityId = builder.entityId == null ? builder.id : builder.entityId;
        this.entityType = builder.entityType == null ? EntityType.ARTICLE : builder.entityType;
        this.title = builder.title == null ? "" : builder.title;
        this.content = builder.content == null ? "" : builder.content;
        this.summary = builder.summary;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.categories = Collections.unmodifiableSet(new LinkedHashSet<>(builder.categories));
        this.language = builder.language;
        this.accessLevel = builder.accessLevel == null ? "public" : builder.accessLevel;
        this.authorId = builder.authorId;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(builder.metadata));
        this.createdAt = builder.createdAt == null ? Instant.EPOCH : builder.createdAt;
        this.updatedAt = builder.updatedAt == null ? this.createdAt : builder.updatedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.id = id;
        builder.entityId = entityId;
        builder.entityType = entityType;
        builder.title = title;
        builder.content = content;
        builder.summary = summary;
        builder.tags.addAll(tags);
        builder.categories.addAll(categories);
        builder.language = language;
        builder.accessLevel = accessLevel;
        builder.authorId = authorId;
        builder.metadata.putAll(metadata);
        builder.createdAt = createdAt;
        builder.updatedAt = updatedAt;
        return builder;
    }

    public String getId() {
        return id;
    }

    public String getEntityId() {
        return entityId;
    }

    public EntityType getEntityType() {
        return entityType;
    }

    public String getTitle() {
        return title;
    }

    public String getContent() {
        return content;
    }

    public String getSummary() {
        return summary;
    }

    public Set<String> getTags() {
        return tags;
    }

    public Set<String> getCategories() {
        return categories;
    }

    public String getLanguage() {
        return language;
    }

    public String getAccessLevel() {
        return accessLevel;
    }

    public String getAuthorId() {
        return authorId;
    }

    public Map<String, MetadataValue> getMetadata() {
        return metadata;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public double numericMetadata(String key, double fallback) {
        MetadataValue value = metadata.get(key);
        if (value instanceof MetadataValue.Numeric numeric) {
            return numeric.value();
        }
        if (value instanceof MetadataValue.Text text) {
            try {
                return Double.parseDouble(text.value().trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    public long viewCount() {
        return (long) numericMetadata("viewCount", 0.0);
    }

    public long likeCount() {
        return (long) numericMetadata("likeCount", 0.0);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SearchDocument that)) {
            return false;
        }
        return Objects.equals(id, that.id)
            && Objects.equals(updatedAt, that.updatedAt)
            && Objects.equals(title, that.title)
            && Objects.equals(content, that.content);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, updatedAt);
    }

    @Override
    public String toString() {
        return "SearchDocument{id=" + id + ", type=" + entityType.key() + ", title=" + title + "}";
    }

    public static final class Builder {
        private String id;
        private String entityId;
        private EntityType entityType;
        private String title;
        private String content;
        private String summary;
        private final Set<String> tags = new LinkedHashSet<>();
        private final Set<String> categories = new LinkedHashSet<>();
        private String language;
        private String accessLevel;
        private String authorId;
        private final Map<String, MetadataValue> metadata = new LinkedHashMap<>();
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder entityType(EntityType entityType) {
            this.entityType = entityType;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder summary(String summary) {
            this.summary = summary;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags.clear();
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public Builder categories(Collection<String> categories) {
            this.categories.clear();
            if (categories != null) {
                this.categories.addAll(categories);
            }
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder accessLevel(String accessLevel) {
            this.accessLevel = accessLevel;
            return this;
        }

        public Builder authorId(String authorId) {
            this.authorId = authorId;
            return this;
        }

        public Builder metadata(String key, Object value) {
            MetadataValue converted = MetadataValue.of(value);
            if (key != null && converted != null) {
                this.metadata.put(key, converted);
            }
            return this;
        }

        public Builder metadata(Map<String, ?> values) {
            if (values != null) {
                values.forEach(this::metadata);
            }
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public SearchDocument build() {
            return new SearchDocument(this);
        }
    }
}
