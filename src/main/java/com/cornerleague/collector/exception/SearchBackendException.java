package com.cornerleague.collector.exception;

public class SearchBackendException extends RuntimeException {

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
