package com.lexkb.search.analysis;

import java.util.Locale;

public enum LegalEntityType {
    LEGAL_TERM,
    DATE,
    AMOUNT,
    ARTICLE,
    CASE_NUMBER,
    COURT;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
