package com.prediction.market.exchange.entity;

/**
 * Order state machine.
 *
 * State Transitions:
 *
 * OPEN → PARTIAL   (some shares matched)
 * OPEN → FILLED    (all shares matched)
 * OPEN → CANCELLED (owner cancelled, market resolved, or pullback cancelled it)
 *
 * PARTIAL → FILLED    (remaining shares matched)
 * PARTIAL → CANCELLED (remaining shares released)
 *
 * Terminal states: FILLED, CANCELLED
 */
public enum OrderStatus {

    /**
     * OPEN: resting in the book, nothing matched yet.
     */
    OPEN,

    /**
     * PARTIAL: some shares matched, the rest still rests in the book.
     */
    PARTIAL,

    /**
     * FILLED: every share matched.
     * TERMINAL STATE - no further transitions.
     */
    FILLED,

    /**
     * CANCELLED: unfilled remainder released and refunded.
     * TERMINAL STATE - no further transitions.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED;
    }

    /**
     * Check if the order still rests in the book (can be matched or cancelled).
     */
    public boolean isActive() {
        return this == OPEN || this == PARTIAL;
    }

    public boolean canTransitionTo(OrderStatus to) {
        if (this.isTerminal()) {
            return false;
        }

        return switch (this) {
            case OPEN -> to == PARTIAL || to == FILLED || to == CANCELLED;
            case PARTIAL -> to == FILLED || to == CANCELLED;
            default -> false;
        };
    }
}
