package com.prediction.market.exchange.bot;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.ExposureSnapshot;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.ledger.LedgerSession;
import com.prediction.market.exchange.risk.ExposureTracker;
import com.prediction.market.exchange.risk.PullbackController;

public class BotAnalytics {

    private final PullbackController pullbackController;

    public BotAnalytics(PullbackController pullbackController) {
        this.pullbackController = pullbackController;
    }

    public BotStats stats(LedgerSession session, BotConfig config) {
        ExposureTracker tracker = pullbackController.getTracker();
        String bot = config.getBotAccountId();
        long exposure = tracker.currentExposure(session, bot);
        int tier = tracker.tier(exposure, config);
        ExposureSnapshot snapshot = pullbackController.load(session);

        List<Order> resting = session.findActiveOrdersByAccount(bot);
        long offered = resting.stream().mapToLong(Order::getRemainingShares).sum();
        long locked = resting.stream().mapToLong(Order::getReservedAmount).sum();
        long available = session.findAccount(bot).map(Account::getBalance).orElse(0L);
        long nextThreshold = (tier + 1L) * config.getMaxLoss() * config.getTierWidthPercent() / 100;

        return BotStats.builder()
            .botAccountId(bot)
            .active(config.isActive())
            .exposure(exposure)
            .maxLoss(config.getMaxLoss())
            .tier(tier)
            .nextThreshold(nextThreshold)
            .pullbackRatio(tracker.pullbackRatio(exposure, config.getMaxLoss()))
            .lastPullbackAt(snapshot.getLastPullbackAt())
            .restingOrders(resting.size())
            .offeredShares(offered)
            .lockedReservation(locked)
            .availableBalance(available)
            .exposureByMarket(tracker.exposureByMarket(session, bot))
            .build();
    }

    public WorstCase worstCase(LedgerSession session, BotConfig config) {
        ExposureTracker tracker = pullbackController.getTracker();
        long exposure = tracker.currentExposure(session, config.getBotAccountId());
        BigDecimal percent = BigDecimal.valueOf(exposure)
            .multiply(BigDecimal.valueOf(100))
            .divide(BigDecimal.valueOf(config.getMaxLoss()), 1, RoundingMode.HALF_UP);
        return WorstCase.builder()
            .currentExposure(exposure)
            .maxLoss(config.getMaxLoss())
            .worstCase(config.getMaxLoss())
            .exposurePercent(percent)
            .remaining(tracker.headroom(exposure, config.getMaxLoss()))
            .build();
    }
}
