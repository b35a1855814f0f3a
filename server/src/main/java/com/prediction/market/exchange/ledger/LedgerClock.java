package com.prediction.market.exchange.ledger;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Strictly increasing event time in epoch milliseconds. Two orders placed in
 * the same millisecond still get distinct creation times, which keeps
 * time priority total.
 */
public class LedgerClock {

    private final Clock clock;
    private final AtomicLong last = new AtomicLong();

    public LedgerClock(Clock clock) {
        this.clock = clock;
    }

    public long tick() {
        long now = clock.millis();
        return last.updateAndGet(previous -> Math.max(now, previous + 1));
    }

    /**
     * Wall-clock time, without the monotonic adjustment.
     */
    public long wallMillis() {
        return clock.millis();
    }
}
