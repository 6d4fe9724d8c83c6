package io.poolscope.store;

public enum ConditionalOutcome {
    APPLIED,
    NOT_APPLIED
}
