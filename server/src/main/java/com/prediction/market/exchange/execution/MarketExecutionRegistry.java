package com.prediction.market.exchange.execution;

import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

/**
 * Serializes order flow per market. Placements in the same market never run
 * concurrently; different markets proceed in parallel.
 *
 * A market that reached a terminal state is retired: its worker is shut down
 * and later work for it runs on the calling thread, since nothing can change
 * such a market any more.
 */
@Slf4j
public class MarketExecutionRegistry {
    private final ConcurrentHashMap<String, MarketExecutor> executors = new ConcurrentHashMap<>();
    private final Set<String> retired = ConcurrentHashMap.newKeySet();

    /**
     * Run {@code work} on the market's worker and wait for it. Exceptions
     * thrown by the work surface unchanged to the caller. Callers check that
     * the market exists first; every id seen here gets a worker thread.
     */
    public <T> T execute(String marketId, Supplier<T> work) {
        if (retired.contains(marketId)) {
            return work.get();
        }
        MarketExecutor executor = executors.computeIfAbsent(marketId, MarketExecutor::new);
        if (retired.contains(marketId)) {
            // retired while the worker was being created
            discard(marketId);
            return work.get();
        }
        try {
            return executor.submit(work).get();
        } catch (RejectedExecutionException e) {
            if (retired.contains(marketId)) {
                return work.get();
            }
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for market " + marketId, e);
        }
    }

    /**
     * Stop serializing work for a resolved or cancelled market and release
     * its thread. Work already queued still runs.
     */
    public void retire(String marketId) {
        if (retired.add(marketId)) {
            discard(marketId);
            log.info("Market executor retired: marketId={}", marketId);
        }
    }

    public boolean isRetired(String marketId) {
        return retired.contains(marketId);
    }

    private void discard(String marketId) {
        MarketExecutor executor = executors.remove(marketId);
        if (executor != null) {
            executor.shutdown();
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        Throwable actual = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (actual instanceof RuntimeException) {
            return (RuntimeException) actual;
        }
        if (actual instanceof Error) {
            throw (Error) actual;
        }
        return new IllegalStateException(actual);
    }

    /**
     * Number of live market workers.
     */
    public int size() {
        return executors.size();
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} market executors", executors.size());
        executors.values().forEach(MarketExecutor::shutdown);
        executors.clear();
    }
}
