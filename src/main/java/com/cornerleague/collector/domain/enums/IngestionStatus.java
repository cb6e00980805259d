package com.cornerleague.collector.domain.enums;

public enum IngestionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
