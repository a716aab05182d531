package com.raditha.mvscan.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Operation-level shape of a write/read pair.
 */
public enum PairPattern {
    STALE_READ("stale_read"),
    CROSS_TX_STALE_READ("cross_tx_stale_read"),
    DESTRUCTIVE_WRITE("destructive_write"),
    REENTRANT_STALE_READ("reentrant_stale_read"),
    REENTRANT_DESTRUCTIVE_WRITE("reentrant_destructive_write");

    private final String label;

    PairPattern(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Reentrant counterpart of this pattern.
     */
    public PairPattern reentrant() {
        return switch (this) {
            case STALE_READ, CROSS_TX_STALE_READ, REENTRANT_STALE_READ -> REENTRANT_STALE_READ;
            case DESTRUCTIVE_WRITE, REENTRANT_DESTRUCTIVE_WRITE -> REENTRANT_DESTRUCTIVE_WRITE;
        };
    }

    public boolean isReentrant() {
        return this == REENTRANT_STALE_READ || this == REENTRANT_DESTRUCTIVE_WRITE;
    }
}
