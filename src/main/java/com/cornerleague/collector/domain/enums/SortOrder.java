package com.cornerleague.collector.domain.enums;

public enum SortOrder {
    RELEVANCE,
    DATE,
    QUALITY
}
