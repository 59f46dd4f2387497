package com.lexkb.search.analysis;

public record LegalEntity(LegalEntityType type, String value, int start, int end) {}
