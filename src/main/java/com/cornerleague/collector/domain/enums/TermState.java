package com.cornerleague.collector.domain.enums;

public enum TermState {
    BASELINE,
    RISING,
    TRENDING,
    DECAYING
}
