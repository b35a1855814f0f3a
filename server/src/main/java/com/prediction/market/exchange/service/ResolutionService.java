package com.prediction.market.exchange.service;

import java.time.Duration;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.exchange.bot.BotSettings;
import com.prediction.market.exchange.config.ExchangeProperties;
import com.prediction.market.exchange.engine.MarketSettlement;
import com.prediction.market.exchange.engine.ResolutionResult;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.MarketStatus;
import com.prediction.market.exchange.entity.ResolutionAction;
import com.prediction.market.exchange.entity.ResolutionLog;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.execution.MarketExecutionRegistry;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerSession;
import com.prediction.market.exchange.ledger.LedgerStore;
import com.prediction.market.exchange.risk.PullbackController;

import lombok.extern.slf4j.Slf4j;

/**
 * Market resolution, direct or two-phase (initiate, wait out the delay, confirm).
 * Every operation runs on the market's executor so it cannot interleave with
 * an order placement in the same market.
 */
@Slf4j
@Service
public class ResolutionService {

    private final LedgerStore ledgerStore;
    private final MarketSettlement settlement;
    private final PullbackController pullbackController;
    private final BotSettings botSettings;
    private final MarketExecutionRegistry registry;
    private final LedgerClock clock;
    private final Duration delay;

    public ResolutionService(LedgerStore ledgerStore, MarketSettlement settlement,
            PullbackController pullbackController, BotSettings botSettings, MarketExecutionRegistry registry,
            LedgerClock clock, ExchangeProperties properties) {
        this.ledgerStore = ledgerStore;
        this.settlement = settlement;
        this.pullbackController = pullbackController;
        this.botSettings = botSettings;
        this.registry = registry;
        this.clock = clock;
        this.delay = properties.getResolution().getDelay();
    }

    public ResolutionResult resolveMarket(String marketId, Side outcome) {
        requireOutcome(outcome);
        ResolutionResult settled = MarketRouting.onMarket(ledgerStore, registry, marketId,
            () -> ledgerStore.inTransaction(session -> {
            ResolutionResult result = settlement.resolve(session, marketId, outcome);
            appendLog(session, marketId, ResolutionAction.RESOLVED, outcome, null, null);
            pullbackController.refresh(session, botSettings.load(session));
            return result;
        }));
        registry.retire(marketId);
        return settled;
    }

    /**
     * Halt trading and schedule the resolution for {@code now + delay}.
     */
    public ResolutionLog initiateResolution(String marketId, Side outcome, String notes) {
        requireOutcome(outcome);
        return MarketRouting.onMarket(ledgerStore, registry, marketId, () -> ledgerStore.inTransaction(session -> {
            Market market = requireMarket(session, marketId);
            if (market.getStatus() != MarketStatus.OPEN) {
                throw new InvalidStateException("Market " + marketId + " is " + market.getStatus()
                    + ", only an open market can enter resolution");
            }
            market.setStatus(MarketStatus.PENDING_RESOLUTION);
            session.saveMarket(market);

            long scheduledAt = clock.wallMillis() + delay.toMillis();
            ResolutionLog entry = appendLog(session, marketId, ResolutionAction.INITIATED, outcome, scheduledAt, notes);
            log.info("Resolution initiated: marketId={}, outcome={}, scheduledAt={}", marketId, outcome, scheduledAt);
            return entry;
        }));
    }

    /**
     * Execute a pending resolution with the outcome recorded at initiation.
     * Before the scheduled time only an emergency confirmation goes through.
     */
    public ResolutionResult confirmResolution(String marketId, boolean emergency) {
        ResolutionResult settled = MarketRouting.onMarket(ledgerStore, registry, marketId,
            () -> ledgerStore.inTransaction(session -> {
            Market market = requireMarket(session, marketId);
            if (market.getStatus() != MarketStatus.PENDING_RESOLUTION) {
                throw new InvalidStateException("Market " + marketId + " has no pending resolution");
            }
            ResolutionLog initiated = session.findLatestResolutionLog(marketId, ResolutionAction.INITIATED)
                .orElseThrow(() -> new InvalidStateException("No resolution was initiated for market " + marketId));
            long now = clock.wallMillis();
            if (!emergency && initiated.getScheduledAt() != null && now < initiated.getScheduledAt()) {
                throw new InvalidStateException("Resolution of market " + marketId + " is scheduled at "
                    + initiated.getScheduledAt() + ", " + (initiated.getScheduledAt() - now) + " ms from now");
            }

            ResolutionResult result = settlement.resolve(session, marketId, initiated.getOutcome());
            appendLog(session, marketId, emergency ? ResolutionAction.EMERGENCY_RESOLVED : ResolutionAction.CONFIRMED,
                initiated.getOutcome(), null, null);
            pullbackController.refresh(session, botSettings.load(session));
            if (emergency) {
                log.warn("Emergency resolution: marketId={}, outcome={}", marketId, initiated.getOutcome());
            }
            return result;
        }));
        registry.retire(marketId);
        return settled;
    }

    public Market abortResolution(String marketId) {
        return MarketRouting.onMarket(ledgerStore, registry, marketId, () -> ledgerStore.inTransaction(session -> {
            Market market = requireMarket(session, marketId);
            if (market.getStatus() != MarketStatus.PENDING_RESOLUTION) {
                throw new InvalidStateException("Market " + marketId + " has no pending resolution");
            }
            market.setStatus(MarketStatus.OPEN);
            session.saveMarket(market);
            appendLog(session, marketId, ResolutionAction.ABORTED, null, null, null);
            log.info("Resolution aborted: marketId={}", marketId);
            return market;
        }));
    }

    public ResolutionResult cancelMarket(String marketId) {
        ResolutionResult settled = MarketRouting.onMarket(ledgerStore, registry, marketId,
            () -> ledgerStore.inTransaction(session -> {
            ResolutionResult result = settlement.cancelMarket(session, marketId);
            pullbackController.refresh(session, botSettings.load(session));
            return result;
        }));
        registry.retire(marketId);
        return settled;
    }

    private static void requireOutcome(Side outcome) {
        if (outcome == null) {
            throw new InvalidArgumentException("outcome is required");
        }
    }

    private static Market requireMarket(LedgerSession session, String marketId) {
        return session.findMarket(marketId).orElseThrow(() -> new NotFoundException("Market", marketId));
    }

    private ResolutionLog appendLog(LedgerSession session, String marketId, ResolutionAction action, Side outcome,
            Long scheduledAt, String notes) {
        ResolutionLog entry = ResolutionLog.builder()
            .id(UUID.randomUUID().toString())
            .marketId(marketId)
            .action(action)
            .outcome(outcome)
            .scheduledAt(scheduledAt)
            .notes(notes)
            .timestamp(clock.tick())
            .build();
        session.appendResolutionLog(entry);
        return entry;
    }
}
