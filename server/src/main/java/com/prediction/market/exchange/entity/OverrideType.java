package com.prediction.market.exchange.entity;

public enum OverrideType {
    DISABLED,
    REPLACED,
    MULTIPLIED
}
