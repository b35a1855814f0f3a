package com.prediction.market.exchange.entity;

/**
 * The two outcomes of a binary market. A YES share pays out when the market
 * resolves YES, a NO share when it resolves NO.
 */
public enum Side {
    YES,
    NO;

    public Side opposite() {
        return this == YES ? NO : YES;
    }
}
