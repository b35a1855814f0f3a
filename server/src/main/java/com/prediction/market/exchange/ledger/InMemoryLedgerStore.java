package com.prediction.market.exchange.ledger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.BotActionLog;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.CurveShape;
import com.prediction.market.exchange.entity.ExposureSnapshot;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.MarketOverride;
import com.prediction.market.exchange.entity.MarketWeight;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.ResolutionLog;
import com.prediction.market.exchange.entity.Transaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Process-local ledger. One lock serializes all transactions, so every unit
 * of work sees a consistent snapshot and commits atomically. A unit of work
 * that throws is discarded without touching committed state.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final ReentrantLock lock = new ReentrantLock();

    final Map<String, Account> accounts = new LinkedHashMap<>();
    final Map<String, Market> markets = new LinkedHashMap<>();
    final Map<String, Order> orders = new LinkedHashMap<>();
    final Map<String, Position> positions = new LinkedHashMap<>();
    final Map<String, Transaction> transactions = new LinkedHashMap<>();
    final Map<String, ExposureSnapshot> exposure = new LinkedHashMap<>();
    final Map<String, BotConfig> botConfig = new LinkedHashMap<>();
    final Map<String, MarketWeight> marketWeights = new LinkedHashMap<>();
    final Map<String, CurveShape> curveShapes = new LinkedHashMap<>();
    final Map<String, MarketOverride> overrides = new LinkedHashMap<>();
    final Map<String, BotActionLog> botActions = new LinkedHashMap<>();
    final Map<String, ResolutionLog> resolutionLogs = new LinkedHashMap<>();

    @Override
    public <T> T inTransaction(Function<LedgerSession, T> work) {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Nested ledger transaction on thread " + Thread.currentThread().getName());
        }
        lock.lock();
        try {
            InMemoryLedgerSession session = new InMemoryLedgerSession(this);
            T result = work.apply(session);
            session.commit();
            return result;
        } catch (RuntimeException e) {
            log.debug("Ledger transaction rolled back: {}", e.getMessage());
            throw e;
        } finally {
            lock.unlock();
        }
    }
}
