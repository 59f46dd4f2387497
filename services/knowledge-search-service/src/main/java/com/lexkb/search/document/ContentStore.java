package com.lexkb.search.document;

import java.util.Iterator;
import java.util.Optional;

public interface ContentStore {
    Optional<SearchDocument> fetch(String docId);

    Iterator<SearchDocument> streamAll();
}
