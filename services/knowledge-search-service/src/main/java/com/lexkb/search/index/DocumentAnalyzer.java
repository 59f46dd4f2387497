package com.lexkb.search.index;

import com.lexkb.search.analysis.AnalysisMode;
import com.lexkb.search.analysis.IndexField;
import com.lexkb.search.analysis.LanguageDetector;
import com.lexkb.search.analysis.LegalEntity;
import com.lexkb.search.analysis.LegalEntityExtractor;
import com.lexkb.search.analysis.LegalTextAnalyzer;
import com.lexkb.search.analysis.TextSummarizer;
import com.lexkb.search.analysis.Token;
import com.lexkb.search.document.CanonicalFields;
import com.lexkb.search.document.DocumentStoreAdapter;
import com.lexkb.search.document.MetadataValue;
import com.lexkb.search.document.SearchDocument;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class DocumentAnalyzer {
    public static final String LEGAL_ENTITIES_KEY = "legal_entities";
    private static final int VALUE_GAP = 1;

    private final LegalTextAnalyzer analyzer;
    private final LegalEntityExtractor entityExtractor;
    private final DocumentStoreAdapter storeAdapter;
    private final IndexProperties properties;

    public DocumentAnalyzer(
        LegalTextAnalyzer analyzer,
        LegalEntityExtractor entityExtractor,
        DocumentStoreAdapter storeAdapter,
        IndexProperties properties
    ) {
        this.analyzer = analyzer;
        this.entityExtractor = entityExtractor;
        this.storeAdapter = storeAdapter;
        this.properties = properties;
    }

    public AnalyzedDocument analyze(SearchDocument document, IndexOptions options) {
        if (document == null || document.getId() == null || document.getId().isBlank()) {
            throw new DocumentIndexingException(document == null ? null : document.getId(), "document id required");
        }
        String docId = document.getId();
        try {
            IndexOptions effective = options == null ? IndexOptions.defaults() : options;
            CanonicalFields fields = storeAdapter.canonicalFields(document);
            SearchDocument enriched = enrich(document, fields, effective);
            String language = LanguageDetector.resolve(document.getLanguage(), fields.title() + " " + fields.content());

            Accumulator accumulator = new Accumulator(docId);
            accumulator.add(IndexField.TITLE, List.of(fields.title()), language);
            accumulator.add(IndexField.SUMMARY, single(enriched.getSummary()), language);
            accumulator.add(IndexField.TAGS, fields.tags(), language);
            accumulator.add(IndexField.CATEGORIES, fields.categories(), language);
            accumulator.add(IndexField.CONTENT, List.of(fields.content()), language);
            return accumulator.toAnalyzedDocument(enriched);
        } catch (DocumentIndexingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new DocumentIndexingException(docId, "analysis failed: " + ex.getMessage(), ex);
        }
    }

    private SearchDocument enrich(SearchDocument document, CanonicalFields fields, IndexOptions options) {
        SearchDocument.Builder builder = null;
        if (options.generateSummary() && fields.summary() == null) {
            String summary = TextSummarizer.summarize(fields.content(), properties.getSummaryMaxLength());
            if (summary != null) {
                builder = document.toBuilder().summary(summary);
            }
        }
        if (document.getLanguage() == null || document.getLanguage().isBlank()) {
            builder = (builder == null ? document.toBuilder() : builder)
                .language(LanguageDetector.detect(fields.title() + " " + fields.content()));
        }
        if (options.extractLegalEntities()) {
            List<LegalEntity> entities = entityExtractor.extract(fields.title() + "\n" + fields.content());
            Map<String, MetadataValue> grouped = new LinkedHashMap<>();
            entityExtractor.group(entities).forEach((type, values) -> grouped.put(type, MetadataValue.text(String.join("; ", values))));
            builder = (builder == null ? document.toBuilder() : builder)
                .metadata(LEGAL_ENTITIES_KEY, new MetadataValue.Nested(grouped));
        }
        return builder == null ? document : builder.build();
    }

    private static List<String> single(String value) {
        return value == null || value.isBlank() ? List.of() : List.of(value);
    }

    private final class Accumulator {
        private final String docId;
        private final Map<String, List<Integer>> positions = new HashMap<>();
        private final Map<IndexField, Integer> fieldLengths = new EnumMap<>(IndexField.class);
        private final Set<String> surfaces = new HashSet<>();
        private int docLength;

        private Accumulator(String docId) {
            this.docId = docId;
        }

        private void add(IndexField field, List<String> values, String language) {
            int cursor = 0;
            int length = 0;
            for (String value : values) {
                List<Token> tokens = analyzer.analyze(value, language, field, AnalysisMode.INDEX);
                int last = -1;
                for (Token token : tokens) {
                    int relative = cursor + token.position();
                    if (relative >= IndexField.POSITION_RANGE) {
                        throw new DocumentIndexingException(docId, "field too long: " + field.name().toLowerCase(Locale.ROOT));
                    }
                    positions.computeIfAbsent(token.term(), key -> new ArrayList<>()).add(field.positionBase() + relative);
                    surfaces.add(token.surface());
                    if (!token.stacked()) {
                        length++;
                    }
                    last = Math.max(last, token.position());
                }
                if (last >= 0) {
                    cursor += last + 1 + VALUE_GAP;
                }
            }
            if (length > 0) {
                fieldLengths.put(field, length);
                docLength += length;
            }
        }

        private AnalyzedDocument toAnalyzedDocument(SearchDocument document) {
            Map<String, Posting> postings = new HashMap<>();
            Map<String, Integer> termVector = new HashMap<>();
            for (Map.Entry<String, List<Integer>> entry : positions.entrySet()) {
                List<Integer> list = entry.getValue();
                int[] raw = new int[list.size()];
                for (int i = 0; i < raw.length; i++) {
                    raw[i] = list.get(i);
                }
                postings.put(entry.getKey(), new Posting(raw));
                termVector.put(entry.getKey(), raw.length);
            }
            ForwardEntry entry = new ForwardEntry(document, docLength, fieldLengths, termVector, surfaces);
            return new AnalyzedDocument(entry, postings);
        }
    }
}
