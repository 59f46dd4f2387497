package com.lexkb.search.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class QuerySpec {
    private final String query;
    private final String language;
    private final Map<String, Set<String>> filters;
    private final DateRange dateRange;
    private final SizeRange sizeRange;
    private final Sort sort;
    private final Pagination pagination;
    private final Options options;
    private final List<String> facets;

    private QuerySpec(Builder builder) {
        this.query = builder.query;
        this.language = builder.language;
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        builder.filters.forEach((key, values) -> copy.put(key, Set.copyOf(values)));
        this.filters = Map.copyOf(copy);
        this.dateRange = builder.dateRange;
        this.sizeRange = builder.sizeRange;
        this.sort = builder.sort;
        this.pagination = builder.pagination;
        this.options = builder.options;
        this.facets = builder.facets == null ? null : List.copyOf(builder.facets);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static QuerySpec of(String query) {
        return builder().query(query).build();
    }

    public String getQuery() {
        return query;
    }

    public String getLanguage() {
        return language;
    }

    public Map<String, Set<String>> getFilters() {
        return filters;
    }

    public DateRange getDateRange() {
        return dateRange;
    }

    public SizeRange getSizeRange() {
        return sizeRange;
    }

    public Sort getSort() {
        return sort;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public Options getOptions() {
        return options;
    }

    public List<String> getFacets() {
        return facets;
    }

    public record DateRange(String from, String to, String field) {}

    public record SizeRange(String min, String max) {}

    public record Sort(String field, String order) {}

    public record Pagination(Integer page, Integer limit) {}

    public record Options(boolean fuzzy, Double minScore, Integer maxResults) {}

    public static final class Builder {
        private String query;
        private String language;
        private final Map<String, Set<String>> filters = new LinkedHashMap<>();
        private DateRange dateRange;
        private SizeRange sizeRange;
        private Sort sort;
        private Pagination pagination;
        private Options options;
        private List<String> facets;

        private Builder() {
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder language(String language) {
            this.language = language;
            return this;
        }

        public Builder filter(String dimension, String... values) {
            return filter(dimension, List.of(values));
        }

        public Builder filter(String dimension, Collection<String> values) {
            if (dimension != null && values != null) {
                Set<String> target = filters.computeIfAbsent(dimension, key -> new LinkedHashSet<>());
                for (String value : values) {
                    if (value != null) {
                        target.add(value);
                    }
                }
            }
            return this;
        }

        public Builder dateRange(String from, String to) {
            return dateRange(from, to, null);
        }

        public Builder dateRange(String from, String to, String field) {
            this.dateRange = new DateRange(from, to, field);
            return this;
        }

        public Builder sizeRange(String min, String max) {
            this.sizeRange = new SizeRange(min, max);
            return this;
        }

        public Builder sort(String field, String order) {
            this.sort = new Sort(field, order);
            return this;
        }

        public Builder page(int page, int limit) {
            this.pagination = new Pagination(page, limit);
            return this;
        }

        public Builder fuzzy(boolean fuzzy) {
            Options current = options == null ? new Options(false, null, null) : options;
            this.options = new Options(fuzzy, current.minScore(), current.maxResults());
            return this;
        }

        public Builder minScore(double minScore) {
            Options current = options == null ? new Options(false, null, null) : options;
            this.options = new Options(current.fuzzy(), minScore, current.maxResults());
            return this;
        }

        public Builder maxResults(int maxResults) {
            Options current = options == null ? new Options(false, null, null) : options;
            this.options = new Options(current.fuzzy(), current.minScore(), maxResults);
            return this;
        }

        public Builder facets(String... dimensions) {
            this.facets = new ArrayList<>(List.of(dimensions));
            return this;
        }

        public QuerySpec build() {
            return new QuerySpec(this);
        }
    }
}
