package com.lexkb.search.query;

import java.util.ArrayList;
import java.util.List;

public record TermClause(List<TermAlternative> alternatives) implements QueryClause {
    public TermClause {
        if (alternatives == null || alternatives.isEmpty()) {
            throw new IllegalArgumentException("term clause requires an alternative");
        }
        alternatives = List.copyOf(alternatives);
    }

    public TermAlternative primary() {
        return alternatives.get(0);
    }

    public TermClause withAlternatives(List<TermAlternative> extra) {
        if (extra.isEmpty()) {
            return this;
        }
        List<TermAlternative> merged = new ArrayList<>(alternatives);
        merged.addAll(extra);
        return new TermClause(merged);
    }

    @Override
    public String text() {
        return primary().surface();
    }
}
