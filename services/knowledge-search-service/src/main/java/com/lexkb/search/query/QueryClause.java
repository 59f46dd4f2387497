package com.lexkb.search.query;

public interface QueryClause {

    String text();
}
