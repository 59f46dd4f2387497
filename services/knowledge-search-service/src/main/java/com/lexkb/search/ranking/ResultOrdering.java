package com.lexkb.search.ranking;

import com.lexkb.search.document.SearchDocument;
import com.lexkb.search.query.SortField;
import com.lexkb.search.query.SortOrder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Result ordering. Whatever the primary key, ties fall back to updatedAt descending and then docId
 * ascending, so equal inputs always produce the same order.
 */
public final class ResultOrdering {
    private static final Comparator<ScoredDocument> TIE_BREAK = Comparator
        .comparing((ScoredDocument scored) -> scored.document().getUpdatedAt(), Comparator.reverseOrder())
        .thenComparing(ScoredDocument::docId);

    private ResultOrdering() {
    }

    public static Comparator<ScoredDocument> comparator(SortField field, SortOrder order) {
        Comparator<ScoredDocument> primary = switch (field) {
            case RELEVANCE -> Comparator.comparingDouble(ScoredDocument::score);
            case DATE -> Comparator.comparing(scored -> scored.document().getCreatedAt());
            case UPDATED -> Comparator.comparing(scored -> scored.document().getUpdatedAt());
            case TITLE -> Comparator.comparing(scored -> titleKey(scored.document()));
            case VIEWS -> Comparator.comparingLong(scored -> scored.document().viewCount());
            case LIKES -> Comparator.comparingLong(scored -> scored.document().likeCount());
        };
        if (order == SortOrder.DESC) {
            primary = primary.reversed();
        }
        return primary.thenComparing(TIE_BREAK);
    }

    /** Sorts and keeps at most {@code maxResults} documents. */
    public static List<ScoredDocument> rank(List<ScoredDocument> documents, SortField field, SortOrder order, int maxResults) {
        List<ScoredDocument> sorted = new ArrayList<>(documents);
        sorted.sort(comparator(field, order));
        if (maxResults > 0 && sorted.size() > maxResults) {
            return new ArrayList<>(sorted.subList(0, maxResults));
        }
        return sorted;
    }

    private static String titleKey(SearchDocument document) {
        return document.getTitle() == null ? "" : document.getTitle().toLowerCase(Locale.ROOT);
    }
}
