package com.lexkb.search.facet;

public record FacetBucket(String value, long count) {}
