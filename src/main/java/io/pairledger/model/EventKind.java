package io.pairledger.model;

public enum EventKind {
    CREATED,
    UPDATED,
    ASSIGNED,
    STATUS_CHANGED
}
