package com.cornerleague.collector.domain.enums;

public enum FetchOutcome {
    SUCCESS,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE
}
