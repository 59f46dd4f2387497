package com.lexkb.search.query;

import com.lexkb.search.document.SearchDocument;
import java.time.Instant;
import java.util.List;
import java.util.Set;

public interface FilterPredicate {

    boolean test(SearchDocument document);

    FacetDimension dimension();

    record Membership(FacetDimension dimension, Set<String> values) implements FilterPredicate {
        public Membership {
            values = Set.copyOf(values);
        }

        @Override
        public boolean test(SearchDocument document) {
            for (String value : dimension.valuesOf(document)) {
                if (values.contains(value)) {
                    return true;
                }
            }
            return false;
        }
    }

    record DateWindow(Instant from, Instant to, boolean onUpdatedAt) implements FilterPredicate {
        @Override
        public boolean test(SearchDocument document) {
            Instant value = onUpdatedAt ? document.getUpdatedAt() : document.getCreatedAt();
            if (from != null && value.isBefore(from)) {
                return false;
            }
            return to == null || !value.isAfter(to);
        }

        @Override
        public FacetDimension dimension() {
            return onUpdatedAt ? null : FacetDimension.DATE;
        }
    }

    record SizeWindow(Long min, Long max) implements FilterPredicate {
        @Override
        public boolean test(SearchDocument document) {
            long size = document.getContent() == null ? 0 : document.getContent().length();
            if (min != null && size < min) {
                return false;
            }
            return max == null || size <= max;
        }

        @Override
        public FacetDimension dimension() {
            return null;
        }
    }

    record All(List<FilterPredicate> children) implements FilterPredicate {
        public All {
            children = List.copyOf(children);
        }

        @Override
        public boolean test(SearchDocument document) {
            for (FilterPredicate child : children) {
                if (!child.test(document)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public FacetDimension dimension() {
            return null;
        }

        public All without(FacetDimension excluded) {
            return new All(children.stream().filter(child -> child.dimension() != excluded).toList());
        }

        public boolean isEmpty() {
            return children.isEmpty();
        }
    }
}
