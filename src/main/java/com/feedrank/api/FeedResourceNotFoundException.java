package com.feedrank.api;

/**
 * A viewer or post referenced by id is not stored. Carries the machine-readable
 * error code reported to the client.
 */
public abstract class FeedResourceNotFoundException extends RuntimeException {

    private final String errorCode;

    protected FeedResourceNotFoundException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
