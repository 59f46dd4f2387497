package com.lexkb.search.query;

public record TermAlternative(String term, String surface, double weight, Kind kind) {

    public enum Kind {
        ORIGINAL,
        SYNONYM,
        FUZZY
    }

    public static TermAlternative original(String term, String surface) {
        return new TermAlternative(term, surface, 1.0, Kind.ORIGINAL);
    }
}
