package com.prediction.market.exchange.entity;

/**
 * Kinds of balance movement recorded in the append-only transaction log.
 */
public enum TransactionType {
    DEPOSIT,
    ORDER_RESERVED,
    PRICE_IMPROVEMENT,
    ORDER_CANCELLED,
    ORDER_REDUCED,
    POSITION_NETTED,
    POSITION_WON,
    POSITION_LOST,
    POSITION_REFUNDED
}
