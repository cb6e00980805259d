package com.cornerleague.collector.exception;

public class FetchException extends RuntimeException {

    private final boolean transientFailure;

    public FetchException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public FetchException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
