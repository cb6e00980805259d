package com.cornerleague.collector.exception;

public class ProcessingFailedException extends RuntimeException {

    public ProcessingFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ProcessingFailedException(Throwable cause) {
        super(cause);
    }
}
