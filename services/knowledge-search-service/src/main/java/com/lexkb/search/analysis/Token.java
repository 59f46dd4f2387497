package com.lexkb.search.analysis;

public record Token(String term, String surface, int position, IndexField field, boolean stacked) {

    public Token withPosition(int newPosition, IndexField newField) {
        return new Token(term, surface, newPosition, newField, stacked);
    }
}
