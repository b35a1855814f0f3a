package com.prediction.market.exchange.ledger;

import org.springframework.dao.OptimisticLockingFailureException;

import com.mongodb.MongoException;

import lombok.Getter;

/**
 * Bounded exponential backoff for transactions that lost a write conflict.
 */
@Getter
public class LedgerRetryPolicy {

    private static final String TRANSIENT_LABEL = "TransientTransactionError";

    private final int maxAttempts;
    private final long initialBackoffMillis;
    private final long maxBackoffMillis;

    public LedgerRetryPolicy(int maxAttempts, long initialBackoffMillis, long maxBackoffMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMillis = initialBackoffMillis;
        this.maxBackoffMillis = maxBackoffMillis;
    }

    public boolean isRetryable(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof OptimisticLockingFailureException) {
                return true;
            }
            if (t instanceof MongoException && ((MongoException) t).hasErrorLabel(TRANSIENT_LABEL)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }

    public long computeDelayMillis(int attempt) {
        long base = Math.max(0, initialBackoffMillis);
        long max = Math.max(base, maxBackoffMillis);
        long delay = base;
        for (int i = 1; i < attempt; i++) {
            delay = Math.min(max, delay * 2);
        }
        return delay;
    }
}
