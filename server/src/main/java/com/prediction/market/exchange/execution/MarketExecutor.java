package com.prediction.market.exchange.execution;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Single worker thread for one market: work submitted here runs one item
 * at a time, in submission order.
 */
public class MarketExecutor {
    private final ExecutorService executor;

    public MarketExecutor(String marketId) {
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "market-" + marketId);
            thread.setDaemon(true);
            return thread;
        });
    }

    public <T> CompletableFuture<T> submit(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, executor);
    }

    public void shutdown() {
        executor.shutdown();
    }
}
