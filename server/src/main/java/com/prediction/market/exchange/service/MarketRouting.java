package com.prediction.market.exchange.service;

import java.util.function.Supplier;

import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.execution.MarketExecutionRegistry;
import com.prediction.market.exchange.ledger.LedgerPostings;
import com.prediction.market.exchange.ledger.LedgerStore;

/**
 * Hands market work to the market's executor once the market is known to
 * exist. Unknown ids never get a worker thread.
 */
final class MarketRouting {

    private MarketRouting() {
    }

    static <T> T onMarket(LedgerStore ledgerStore, MarketExecutionRegistry registry, String marketId,
            Supplier<T> work) {
        Market market = ledgerStore.inTransaction(session -> LedgerPostings.requireMarket(session, marketId));
        if (market.getStatus().isTerminal()) {
            registry.retire(marketId);
        }
        return registry.execute(marketId, work);
    }
}
