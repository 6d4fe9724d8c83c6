package io.poolscope.store;

public enum UpsertOutcome {
    CREATED,
    UPDATED
}
