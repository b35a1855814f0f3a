package com.prediction.market.exchange.ledger;

import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Transactional store behind accounts, markets, orders, positions and the
 * bot's risk state.
 *
 * Every mutation happens inside {@link #inTransaction}: the work either
 * commits as one unit or, if it throws, leaves no trace.
 */
public interface LedgerStore {

    <T> T inTransaction(Function<LedgerSession, T> work);

    default void run(Consumer<LedgerSession> work) {
        inTransaction(session -> {
            work.accept(session);
            return null;
        });
    }
}
