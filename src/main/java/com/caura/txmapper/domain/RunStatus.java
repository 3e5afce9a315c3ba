package com.caura.txmapper.domain;

/**
 * Lifecycle of a persisted reconciliation run.
 */
public enum RunStatus {
    PENDING,
    SUCCESS,
    FAILED
}
