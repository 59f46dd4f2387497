package com.lexkb.search.suggest;

public enum SuggestionType {
    TERM,
    FUZZY,
    TITLE
}
