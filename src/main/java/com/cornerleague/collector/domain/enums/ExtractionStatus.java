package com.cornerleague.collector.domain.enums;

public enum ExtractionStatus {
    PENDING,
    EXTRACTED,
    FAILED,
    SKIPPED
}
