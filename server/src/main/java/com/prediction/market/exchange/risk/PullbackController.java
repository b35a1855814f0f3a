package com.prediction.market.exchange.risk;

import java.util.Optional;
import java.util.UUID;

import com.prediction.market.exchange.entity.BotAction;
import com.prediction.market.exchange.entity.BotActionLog;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.ExposureSnapshot;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.TransactionType;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerPostings;
import com.prediction.market.exchange.ledger.LedgerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the bot's resting liquidity in line with its exposure.
 *
 * After every change to the bot's positions the exposure snapshot is
 * recomputed. When the exposure tier moved, every resting bot order in every
 * market is shrunk to {@code floor(remaining × (maxLoss - exposure) / maxLoss)}
 * shares, or cancelled below the minimum order size, in the caller's
 * transaction. At {@code exposure >= maxLoss} nothing stays on offer.
 */
@Slf4j
public class PullbackController {

    private final ExposureTracker tracker;
    private final LedgerClock clock;

    public PullbackController(ExposureTracker tracker, LedgerClock clock) {
        this.tracker = tracker;
        this.clock = clock;
    }

    public ExposureTracker getTracker() {
        return tracker;
    }

    /**
     * Re-evaluate exposure and shrink the bot's book if the tier moved.
     *
     * @return the pass that ran, or empty if the tier held or the bot is inactive
     */
    public Optional<PullbackOutcome> evaluate(LedgerSession session, BotConfig config) {
        ExposureSnapshot snapshot = load(session);
        long before = snapshot.getTotalAtRisk();
        int previousTier = snapshot.getTier();

        long exposure = tracker.currentExposure(session, config.getBotAccountId());
        int newTier = tracker.tier(exposure, config);
        long now = clock.tick();

        snapshot.setTotalAtRisk(exposure);
        snapshot.setTier(newTier);
        snapshot.setUpdatedAt(now);

        if (newTier == previousTier || !config.isActive()) {
            session.saveExposure(snapshot);
            return Optional.empty();
        }

        PullbackOutcome outcome = shrink(session, config, previousTier, newTier, exposure);
        snapshot.setLastPullbackAt(now);
        session.saveExposure(snapshot);

        session.appendBotAction(BotActionLog.builder()
            .id(UUID.randomUUID().toString())
            .action(BotAction.PULLBACK)
            .details(String.format("tier %d -> %d, ratio=%s, reduced=%d, cancelled=%d, refunded=%d",
                previousTier, newTier, outcome.getPullbackRatio().toPlainString(),
                outcome.getOrdersReduced(), outcome.getOrdersCancelled(), outcome.getRefunded()))
            .exposureBefore(before)
            .exposureAfter(exposure)
            .timestamp(now)
            .build());

        log.info("Pullback executed: tier {} -> {}, exposure={}, maxLoss={}, reduced={}, cancelled={}, refunded={}",
            previousTier, newTier, exposure, config.getMaxLoss(),
            outcome.getOrdersReduced(), outcome.getOrdersCancelled(), outcome.getRefunded());
        return Optional.of(outcome);
    }

    /**
     * Recompute the snapshot without touching any order.
     */
    public ExposureSnapshot refresh(LedgerSession session, BotConfig config) {
        ExposureSnapshot snapshot = load(session);
        long exposure = tracker.currentExposure(session, config.getBotAccountId());
        snapshot.setTotalAtRisk(exposure);
        snapshot.setTier(tracker.tier(exposure, config));
        snapshot.setUpdatedAt(clock.tick());
        session.saveExposure(snapshot);
        return snapshot;
    }

    public ExposureSnapshot load(LedgerSession session) {
        return session.findExposure().orElseGet(ExposureSnapshot::empty);
    }

    private PullbackOutcome shrink(LedgerSession session, BotConfig config, int previousTier, int newTier,
            long exposure) {
        int reduced = 0;
        int cancelled = 0;
        long released = 0;
        long refunded = 0;

        for (Order order : session.findActiveOrdersByAccount(config.getBotAccountId())) {
            int remaining = order.getRemainingShares();
            int newRemaining = (int) tracker.scale(remaining, exposure, config.getMaxLoss());
            if (newRemaining == remaining) {
                continue;
            }
            if (newRemaining < config.getMinOrderShares()) {
                newRemaining = 0;
            }

            long ts = clock.tick();
            long refund = order.shrinkTo(newRemaining, ts);
            session.saveOrder(order);
            if (refund > 0) {
                LedgerPostings.credit(session, order.getAccountId(), refund,
                    newRemaining == 0 ? TransactionType.ORDER_CANCELLED : TransactionType.ORDER_REDUCED,
                    order.getMarketId(), order.getId(), ts);
            }

            if (newRemaining == 0) {
                cancelled++;
            } else {
                reduced++;
            }
            released += remaining - newRemaining;
            refunded += refund;
        }

        return PullbackOutcome.builder()
            .previousTier(previousTier)
            .newTier(newTier)
            .exposure(exposure)
            .pullbackRatio(tracker.pullbackRatio(exposure, config.getMaxLoss()))
            .ordersReduced(reduced)
            .ordersCancelled(cancelled)
            .sharesReleased(released)
            .refunded(refunded)
            .build();
    }
}
