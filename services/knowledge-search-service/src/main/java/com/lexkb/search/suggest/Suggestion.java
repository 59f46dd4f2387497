package com.lexkb.search.suggest;

public record Suggestion(String text, double score, SuggestionType type) {}
