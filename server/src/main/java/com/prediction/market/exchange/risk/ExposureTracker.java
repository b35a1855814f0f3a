package com.prediction.market.exchange.risk;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.Map;
import java.util.TreeMap;

import com.prediction.market.exchange.engine.CostModel;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.ledger.LedgerSession;

/**
 * Worst-case loss of the bot: the payout it owes if every active position
 * where it holds NO resolves YES. Always recomputed from positions.
 */
public class ExposureTracker {

    private final CostModel costModel;

    public ExposureTracker(CostModel costModel) {
        this.costModel = costModel;
    }

    public long currentExposure(LedgerSession session, String botAccountId) {
        long total = 0;
        for (Position position : session.findActiveShortPositions(botAccountId)) {
            total = Math.addExact(total, costModel.payout(position.getShares()));
        }
        return total;
    }

    public Map<String, Long> exposureByMarket(LedgerSession session, String botAccountId) {
        Map<String, Long> byMarket = new TreeMap<>();
        for (Position position : session.findActiveShortPositions(botAccountId)) {
            byMarket.merge(position.getMarketId(), costModel.payout(position.getShares()), Math::addExact);
        }
        return byMarket;
    }

    /**
     * Exposure bucketed into bands of {@code tierWidthPercent} percent of max loss.
     */
    public int tier(long exposure, BotConfig config) {
        if (config.getMaxLoss() <= 0 || config.getTierWidthPercent() <= 0) {
            return 0;
        }
        BigInteger band = BigInteger.valueOf(config.getMaxLoss())
            .multiply(BigInteger.valueOf(config.getTierWidthPercent()));
        return BigInteger.valueOf(exposure).multiply(BigInteger.valueOf(100)).divide(band).intValueExact();
    }

    /**
     * {@code max(0, 1 - exposure / maxLoss)}, for reporting. Sizing uses
     * {@link #scale} so no rounding creeps into order sizes.
     */
    public BigDecimal pullbackRatio(long exposure, long maxLoss) {
        if (maxLoss <= 0 || exposure >= maxLoss) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(maxLoss - exposure).divide(BigDecimal.valueOf(maxLoss), MathContext.DECIMAL64);
    }

    /**
     * {@code floor(quantity × (maxLoss - exposure) / maxLoss)}, zero at or beyond max loss.
     */
    public long scale(long quantity, long exposure, long maxLoss) {
        if (maxLoss <= 0 || exposure >= maxLoss) {
            return 0;
        }
        return BigInteger.valueOf(quantity)
            .multiply(BigInteger.valueOf(maxLoss - exposure))
            .divide(BigInteger.valueOf(maxLoss))
            .longValueExact();
    }

    public long headroom(long exposure, long maxLoss) {
        return Math.max(0, maxLoss - exposure);
    }
}
