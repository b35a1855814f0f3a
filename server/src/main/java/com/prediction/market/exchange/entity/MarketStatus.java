package com.prediction.market.exchange.entity;

/**
 * Market lifecycle: OPEN → PENDING_RESOLUTION → RESOLVED, or OPEN → CANCELLED.
 * A pending resolution may be aborted back to OPEN.
 */
public enum MarketStatus {
    OPEN,
    PENDING_RESOLUTION,
    RESOLVED,
    CANCELLED;

    public boolean isTerminal() {
        return this == RESOLVED || this == CANCELLED;
    }
}
