package com.lexkb.search.index;

public class DocumentIndexingException extends RuntimeException {
    private final String docId;

    public DocumentIndexingException(String docId, String message) {
        super(message);
        this.docId = docId;
    }

    public DocumentIndexingException(String docId, String message, Throwable cause) {
        super(message, cause);
        this.docId = docId;
    }

    public String getDocId() {
        return docId;
    }
}
