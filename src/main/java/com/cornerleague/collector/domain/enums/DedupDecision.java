package com.cornerleague.collector.domain.enums;

public enum DedupDecision {
    UNIQUE,
    EXACT_DUPLICATE,
    NEAR_DUPLICATE
}
