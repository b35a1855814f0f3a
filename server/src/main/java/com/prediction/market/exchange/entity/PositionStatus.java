package com.prediction.market.exchange.entity;

public enum PositionStatus {
    /** Locked, waiting for resolution or netting. */
    ACTIVE,
    /** Paid out by resolution or by auto-settlement. */
    SETTLED,
    /** Market cancelled, both sides got their stake back. */
    REFUNDED
}
