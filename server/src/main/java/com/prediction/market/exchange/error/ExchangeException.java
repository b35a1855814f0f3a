package com.prediction.market.exchange.error;

/**
 * Base of every failure the exchange reports to its callers.
 *
 * Thrown from inside a ledger transaction, any subclass rolls the whole
 * unit of work back.
 */
public abstract class ExchangeException extends RuntimeException {

    private final ErrorKind kind;

    protected ExchangeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
