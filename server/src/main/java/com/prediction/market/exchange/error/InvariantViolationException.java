package com.prediction.market.exchange.error;

/**
 * A ledger invariant would break (negative balance, overfill, ...).
 * Never a normal trading outcome: the enclosing transaction is aborted and
 * the failure surfaces as an internal error.
 */
public class InvariantViolationException extends ExchangeException {

    public InvariantViolationException(String message) {
        super(ErrorKind.INVARIANT_VIOLATION, "INVARIANT VIOLATION: " + message);
    }
}
