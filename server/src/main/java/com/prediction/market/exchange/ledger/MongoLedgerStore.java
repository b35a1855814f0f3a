package com.prediction.market.exchange.ledger;

import java.util.function.Function;

import org.springframework.transaction.support.TransactionTemplate;

import lombok.extern.slf4j.Slf4j;

/**
 * Ledger on MongoDB multi-document transactions. Requires a replica set.
 *
 * A unit of work that hits a write conflict (stale {@code @Version} or a
 * transient transaction error) is re-run from scratch on a fresh session.
 */
@Slf4j
public class MongoLedgerStore implements LedgerStore {

    private final TransactionTemplate transactionTemplate;
    private final MongoLedgerRepositories repositories;
    private final LedgerRetryPolicy retryPolicy;

    public MongoLedgerStore(TransactionTemplate transactionTemplate, MongoLedgerRepositories repositories,
            LedgerRetryPolicy retryPolicy) {
        this.transactionTemplate = transactionTemplate;
        this.repositories = repositories;
        this.retryPolicy = retryPolicy;
    }

    @Override
    public <T> T inTransaction(Function<LedgerSession, T> work) {
        int attempt = 1;
        while (true) {
            try {
                return transactionTemplate.execute(status -> work.apply(new MongoLedgerSession(repositories)));
            } catch (RuntimeException e) {
                if (!retryPolicy.isRetryable(e) || attempt >= retryPolicy.getMaxAttempts()) {
                    throw e;
                }
                long delay = retryPolicy.computeDelayMillis(attempt);
                log.warn("Ledger write conflict (attempt {}/{}), retrying in {}ms: {}",
                    attempt, retryPolicy.getMaxAttempts(), delay, e.getMessage());
                sleep(delay);
                attempt++;
            }
        }
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while retrying ledger transaction", e);
        }
    }
}
