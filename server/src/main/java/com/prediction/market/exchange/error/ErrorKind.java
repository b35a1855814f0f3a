package com.prediction.market.exchange.error;

public enum ErrorKind {
    INVALID_ARGUMENT,
    NOT_FOUND,
    INVALID_STATE,
    FORBIDDEN,
    INSUFFICIENT_FUNDS,
    INVARIANT_VIOLATION
}
