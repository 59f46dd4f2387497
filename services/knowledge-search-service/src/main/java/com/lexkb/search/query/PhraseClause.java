package com.lexkb.search.query;

import java.util.List;

public record PhraseClause(String text, List<String> terms, List<String> surfaces, List<Integer> offsets)
    implements QueryClause {
    public PhraseClause {
        terms = List.copyOf(terms);
        surfaces = List.copyOf(surfaces);
        offsets = List.copyOf(offsets);
        if (terms.size() < 2 || terms.size() != offsets.size()) {
            throw new IllegalArgumentException("phrase clause requires at least two positioned terms");
        }
    }
}
