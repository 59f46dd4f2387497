package com.lexkb.search.query;

public class InvalidQueryException extends RuntimeException {
    private final String reason;

    public InvalidQueryException(String reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidQueryException(String reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
