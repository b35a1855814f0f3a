package com.prediction.market.exchange.liquidity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

import com.prediction.market.exchange.engine.CostModel;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.ledger.LedgerSession;
import com.prediction.market.exchange.risk.ExposureTracker;

/**
 * Computes the ladder the bot should keep resting in a market:
 *
 * amount = floor(totalLiquidity × marketWeight × globalMultiplier
 *                × overrideMultiplier × pullbackRatio × shapeWeight)
 *
 * in payout units per price point, and {@code amount / P} NO shares at the
 * complement of each YES price. Points below the minimum order size are dropped.
 * Computing a ladder never writes to the ledger.
 */
public class LiquidityShaper {

    private final CostModel costModel;
    private final ExposureTracker exposureTracker;
    private final CurveShapeLibrary shapes;
    private final MarketWeightBalancer weights;

    public LiquidityShaper(CostModel costModel, ExposureTracker exposureTracker, CurveShapeLibrary shapes,
            MarketWeightBalancer weights) {
        this.costModel = costModel;
        this.exposureTracker = exposureTracker;
        this.shapes = shapes;
        this.weights = weights;
    }

    /**
     * @return the target ladder in ascending price order, or {@code null} if the bot is disabled in this market
     */
    public List<LadderPoint> computeEffectiveCurve(LedgerSession session, String marketId, BotConfig config) {
        session.findMarket(marketId).orElseThrow(() -> new NotFoundException("Market", marketId));

        OverrideRule rule = OverrideRule.from(session.findMarketOverride(marketId).orElse(null));
        if (rule.isDisabled()) {
            return null;
        }

        List<CurvePoint> shape = rule.getKind() == OverrideRule.Kind.REPLACED
            ? rule.getCurve()
            : shapes.defaultPoints(session);

        long exposure = exposureTracker.currentExposure(session, config.getBotAccountId());
        long maxLoss = config.getMaxLoss();
        long headroom = exposureTracker.headroom(exposure, maxLoss);
        if (headroom == 0) {
            return List.of();
        }

        BigDecimal budget = BigDecimal.valueOf(config.getTotalLiquidity())
            .multiply(weights.weightOf(session, marketId))
            .multiply(config.getGlobalMultiplier())
            .multiply(rule.getMultiplier())
            .multiply(BigDecimal.valueOf(headroom));
        BigDecimal denominator = BigDecimal.valueOf(maxLoss);

        List<LadderPoint> ladder = new ArrayList<>();
        for (CurvePoint point : shape) {
            long amount = budget.multiply(BigDecimal.valueOf(point.getWeight()))
                .divide(denominator, 0, RoundingMode.FLOOR)
                .longValueExact();
            long shares = amount / costModel.getPayoutUnit();
            if (shares <= 0 || shares < config.getMinOrderShares()) {
                continue;
            }
            int price = PricePoints.yesPrice(point.getPrice(), costModel.getPayoutUnit());
            if (!costModel.isValidPrice(price)) {
                continue;
            }
            ladder.add(LadderPoint.builder()
                .percent(point.getPrice())
                .price(price)
                .noPrice(costModel.complement(price))
                .amount(amount)
                .shares(Math.toIntExact(shares))
                .build());
        }
        ladder.sort((a, b) -> Integer.compare(a.getPrice(), b.getPrice()));
        return ladder;
    }
}
