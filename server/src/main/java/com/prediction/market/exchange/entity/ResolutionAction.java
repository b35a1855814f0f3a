package com.prediction.market.exchange.entity;

public enum ResolutionAction {
    INITIATED,
    CONFIRMED,
    EMERGENCY_RESOLVED,
    RESOLVED,
    ABORTED
}
