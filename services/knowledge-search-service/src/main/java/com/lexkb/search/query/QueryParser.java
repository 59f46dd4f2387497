package com.lexkb.search.query;

import com.lexkb.search.analysis.LanguageDetector;
import com.lexkb.search.analysis.LegalTextAnalyzer;
import com.lexkb.search.analysis.Token;
import com.lexkb.search.document.EntityType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

@Component
public class QueryParser {
    private static final Pattern QUOTED = Pattern.compile("\"([^\"]*)\"");
    private static final Pattern MONTH = Pattern.compile("\\d{4}-\\d{2}");
    private static final List<FacetDimension> DEFAULT_FACETS = List.of(
        FacetDimension.TYPE,
        FacetDimension.CATEGORIES,
        FacetDimension.TAGS,
        FacetDimension.ACCESS_LEVEL,
        FacetDimension.DATE
    );

    private final LegalTextAnalyzer analyzer;
    private final QueryProperties properties;
    private final Map<String, List<TermAlternative>> synonyms;

    public QueryParser(LegalTextAnalyzer analyzer, QueryProperties properties) {
        this.analyzer = analyzer;
        this.properties = properties;
        List<Collection<String>> groups = new ArrayList<>(analyzer.getDictionary().getSynonymGroups());
        groups.addAll(properties.getSynonyms());
        this.synonyms = buildSynonymIndex(groups);
    }

    public QueryPlan parse(QuerySpec spec) {
        if (spec == null) {
            throw new InvalidQueryException("missing_query", "query spec required");
        }
        String normalized = spec.getQuery() == null ? "" : spec.getQuery().trim().replaceAll("\\s+", " ");
        String language = LanguageDetector.resolve(spec.getLanguage(), normalized);

        List<QueryClause> clauses = new ArrayList<>();
        Set<String> seenTerms = new LinkedHashSet<>();
        StringBuilder rest = new StringBuilder();
        Matcher matcher = QUOTED.matcher(normalized);
        int last = 0;
        while (matcher.find()) {
            rest.append(normalized, last, matcher.start()).append(' ');
            addPhrase(matcher.group(1), language, clauses, seenTerms);
            last = matcher.end();
        }
        rest.append(normalized.substring(last));
        for (Token token : analyzer.analyzeQuery(rest.toString().replace('"', ' '), language)) {
            addTerm(token, clauses, seenTerms);
        }
        boolean matchNone = !normalized.isEmpty() && clauses.isEmpty();

        Map<String, Object> keyFields = new LinkedHashMap<>();
        keyFields.put("q", normalized);
        keyFields.put("lang", language);
        FilterPredicate.All filters = parseFilters(spec, keyFields);

        SortField sortField = SortField.from(spec.getSort() == null ? null : spec.getSort().field());
        SortOrder sortOrder = spec.getSort() == null || spec.getSort().order() == null || spec.getSort().order().isBlank()
            ? defaultOrder(sortField)
            : SortOrder.from(spec.getSort().order());
        keyFields.put("sort", sortField.name() + ":" + sortOrder.name());

        int page = pageOf(spec.getPagination());
        int limit = limitOf(spec.getPagination());
        keyFields.put("page", page);
        keyFields.put("limit", limit);

        QuerySpec.Options options = spec.getOptions();
        boolean fuzzy = options != null && options.fuzzy();
        double minScore = options == null || options.minScore() == null ? 0.0 : options.minScore();
        if (Double.isNaN(minScore) || Double.isInfinite(minScore)) {
            throw new InvalidQueryException("invalid_option", "minScore must be finite");
        }
        int maxResults = options == null || options.maxResults() == null || options.maxResults() <= 0
            ? properties.getDefaultMaxResults()
            : options.maxResults();
        keyFields.put("fuzzy", fuzzy);
        keyFields.put("min_score", minScore);
        keyFields.put("max_results", maxResults);

        List<FacetDimension> facets = parseFacets(spec.getFacets());
        keyFields.put("facets", facets.stream().map(FacetDimension::key).toList());

        return new QueryPlan(
            normalized,
            language,
            clauses,
            matchNone,
            filters,
            sortField,
            sortOrder,
            page,
            limit,
            fuzzy,
            minScore,
            maxResults,
            facets,
            keyFields
        );
    }

    private void addPhrase(String text, String language, List<QueryClause> clauses, Set<String> seenTerms) {
        List<Token> tokens = analyzer.analyzeQuery(text, language);
        if (tokens.isEmpty()) {
            return;
        }
        if (tokens.size() == 1) {
            addTerm(tokens.get(0), clauses, seenTerms);
            return;
        }
        List<String> terms = new ArrayList<>();
        List<String> surfaces = new ArrayList<>();
        List<Integer> offsets = new ArrayList<>();
        int first = tokens.get(0).position();
        for (Token token : tokens) {
            terms.add(token.term());
            surfaces.add(token.surface());
            offsets.add(token.position() - first);
        }
        clauses.add(new PhraseClause(text.trim(), terms, surfaces, offsets));
    }

    private void addTerm(Token token, List<QueryClause> clauses, Set<String> seenTerms) {
        if (!seenTerms.add(token.term())) {
            return;
        }
        List<TermAlternative> alternatives = new ArrayList<>();
        alternatives.add(TermAlternative.original(token.term(), token.surface()));
        alternatives.addAll(synonyms.getOrDefault(token.term(), List.of()));
        clauses.add(new TermClause(alternatives));
    }

    private FilterPredicate.All parseFilters(QuerySpec spec, Map<String, Object> keyFields) {
        Map<FacetDimension, Set<String>> byDimension = new EnumMap<>(FacetDimension.class);
        for (Map.Entry<String, Set<String>> entry : spec.getFilters().entrySet()) {
            FacetDimension dimension = FacetDimension.from(entry.getKey());
            if (dimension == null) {
                throw new InvalidQueryException("unknown_dimension", "unknown filter dimension: " + entry.getKey());
            }
            Set<String> values = byDimension.computeIfAbsent(dimension, key -> new TreeSet<>());
            for (String raw : entry.getValue()) {
                String value = FacetDimension.normalizeValue(raw);
                if (!value.isEmpty()) {
                    values.add(validateValue(dimension, value, raw));
                }
            }
        }

        List<FilterPredicate> children = new ArrayList<>();
        Map<String, Object> filterKey = new TreeMap<>();
        byDimension.forEach((dimension, values) -> {
            if (!values.isEmpty()) {
                children.add(new FilterPredicate.Membership(dimension, values));
                filterKey.put(dimension.key(), List.copyOf(values));
            }
        });

        FilterPredicate.DateWindow dateWindow = parseDateRange(spec.getDateRange());
        if (dateWindow != null) {
            children.add(dateWindow);
            filterKey.put("date_range", String.valueOf(dateWindow.from()) + "/" + dateWindow.to() + "/" + dateWindow.onUpdatedAt());
        }
        FilterPredicate.SizeWindow sizeWindow = parseSizeRange(spec.getSizeRange());
        if (sizeWindow != null) {
            children.add(sizeWindow);
            filterKey.put("size_range", sizeWindow.min() + "/" + sizeWindow.max());
        }
        keyFields.put("filters", filterKey);
        return new FilterPredicate.All(children);
    }

    private String validateValue(FacetDimension dimension, String value, String raw) {
        if (dimension == FacetDimension.TYPE) {
            EntityType type = EntityType.from(value);
            if (type == null) {
                throw new InvalidQueryException("invalid_filter", "unknown entity type: " + raw);
            }
            return type.key();
        }
        if (dimension == FacetDimension.DATE && !MONTH.matcher(value).matches()) {
            throw new InvalidQueryException("invalid_filter", "date filter values must be yyyy-MM: " + raw);
        }
        return value;
    }

    private FilterPredicate.DateWindow parseDateRange(QuerySpec.DateRange range) {
        if (range == null) {
            return null;
        }
        String field = range.field() == null ? "" : range.field().trim().toLowerCase(Locale.ROOT);
        boolean onUpdatedAt = switch (field) {
            case "", "createdat", "created_at", "created" -> false;
            case "updatedat", "updated_at", "updated" -> true;
            default -> throw new InvalidQueryException("invalid_date_range", "unknown date field: " + range.field());
        };
        Instant from = parseInstant(range.from(), false);
        Instant to = parseInstant(range.to(), true);
        if (from == null && to == null) {
            return null;
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidQueryException("invalid_date_range", "date range from is after to");
        }
        return new FilterPredicate.DateWindow(from, to, onUpdatedAt);
    }

    private Instant parseInstant(String raw, boolean upperBound) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            if (value.length() == 7 && MONTH.matcher(value).matches()) {
                YearMonth month = YearMonth.parse(value);
                return upperBound
                    ? month.plusMonths(1).atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1)
                    : month.atDay(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (value.length() == 10) {
                LocalDate date = LocalDate.parse(value);
                return upperBound
                    ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusNanos(1)
                    : date.atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            if (value.endsWith("Z")) {
                return Instant.parse(value);
            }
            if (value.contains("+") || value.lastIndexOf('-') > 9) {
                return OffsetDateTime.parse(value).toInstant();
            }
            return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException ex) {
            throw new InvalidQueryException("invalid_date_range", "unparsable date: " + raw, ex);
        }
    }

    private FilterPredicate.SizeWindow parseSizeRange(QuerySpec.SizeRange range) {
        if (range == null) {
            return null;
        }
        Long min = parseSize(range.min());
        Long max = parseSize(range.max());
        if (min == null && max == null) {
            return null;
        }
        if (min != null && max != null && min > max) {
            throw new InvalidQueryException("invalid_size_range", "size range min is greater than max");
        }
        return new FilterPredicate.SizeWindow(min, max);
    }

    private Long parseSize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            long value = Long.parseLong(raw.trim());
            if (value < 0) {
                throw new InvalidQueryException("invalid_size_range", "size bound must not be negative: " + raw);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new InvalidQueryException("invalid_size_range", "unparsable size: " + raw, ex);
        }
    }

    private List<FacetDimension> parseFacets(List<String> requested) {
        if (requested == null) {
            return DEFAULT_FACETS;
        }
        Set<FacetDimension> dimensions = new LinkedHashSet<>();
        for (String raw : requested) {
            FacetDimension dimension = FacetDimension.from(raw);
            if (dimension == null) {
                throw new InvalidQueryException("unknown_dimension", "unknown facet dimension: " + raw);
            }
            dimensions.add(dimension);
        }
        return List.copyOf(dimensions);
    }

    private int pageOf(QuerySpec.Pagination pagination) {
        if (pagination == null || pagination.page() == null || pagination.page() < 1) {
            return 1;
        }
        return pagination.page();
    }

    private int limitOf(QuerySpec.Pagination pagination) {
        int maxLimit = Math.max(1, properties.getMaxLimit());
        if (pagination == null || pagination.limit() == null || pagination.limit() <= 0) {
            return Math.min(Math.max(1, properties.getDefaultLimit()), maxLimit);
        }
        return Math.min(pagination.limit(), maxLimit);
    }

    private static SortOrder defaultOrder(SortField field) {
        return field == SortField.TITLE ? SortOrder.ASC : SortOrder.DESC;
    }

    private Map<String, List<TermAlternative>> buildSynonymIndex(List<? extends Collection<String>> groups) {
        Map<String, List<TermAlternative>> index = new HashMap<>();
        for (Collection<String> group : groups) {
            if (group == null) {
                continue;
            }
            List<Token> members = new ArrayList<>();
            for (String entry : group) {
                List<Token> tokens = analyzer.analyzeQuery(entry, null);
                // multi-word synonyms would need phrase alternatives
                if (tokens.size() == 1) {
                    members.add(tokens.get(0));
                }
            }
            for (Token member : members) {
                List<TermAlternative> alternatives = index.computeIfAbsent(member.term(), key -> new ArrayList<>());
                for (Token other : members) {
                    if (other.term().equals(member.term())) {
                        continue;
                    }
                    boolean known = alternatives.stream().anyMatch(existing -> existing.term().equals(other.term()));
                    if (!known) {
                        alternatives.add(new TermAlternative(other.term(), other.surface(), 1.0, TermAlternative.Kind.SYNONYM));
                    }
                }
            }
        }
        return index;
    }
}
