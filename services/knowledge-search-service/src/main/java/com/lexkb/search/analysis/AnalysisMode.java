package com.lexkb.search.analysis;

public enum AnalysisMode {
    INDEX,
    QUERY
}
