package com.prediction.market.exchange.entity;

/**
 * Kinds of liquidity curve shape.
 */
public enum ShapeType {
    BELL,
    FLAT,
    EXPONENTIAL,
    LOGARITHMIC,
    SIGMOID,
    PARABOLIC,
    CUSTOM
}
