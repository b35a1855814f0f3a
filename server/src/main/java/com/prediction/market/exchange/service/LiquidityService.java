package com.prediction.market.exchange.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.prediction.market.exchange.bot.BotSettings;
import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.entity.CurveShape;
import com.prediction.market.exchange.entity.MarketOverride;
import com.prediction.market.exchange.entity.MarketWeight;
import com.prediction.market.exchange.entity.OverrideType;
import com.prediction.market.exchange.entity.ShapeType;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerStore;
import com.prediction.market.exchange.liquidity.CurveShapeLibrary;
import com.prediction.market.exchange.liquidity.LadderPoint;
import com.prediction.market.exchange.liquidity.LiquidityShaper;
import com.prediction.market.exchange.liquidity.MarketWeightBalancer;
import com.prediction.market.exchange.liquidity.OverrideRule;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Shapes, market weights and per-market overrides: everything that decides
 * how much the bot offers where, each call in its own ledger transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiquidityService {

    private final LedgerStore ledgerStore;
    private final CurveShapeLibrary shapes;
    private final MarketWeightBalancer weights;
    private final LiquidityShaper shaper;
    private final BotSettings botSettings;
    private final LedgerClock clock;

    public CurveShape saveCurveShape(String name, ShapeType type, Map<String, Double> params,
            List<CurvePoint> customPoints) {
        return ledgerStore.inTransaction(session -> shapes.save(session, name, type, params, customPoints));
    }

    public List<CurveShape> listCurveShapes() {
        return ledgerStore.inTransaction(shapes::list);
    }

    public CurveShape getCurveShape(String shapeId) {
        return ledgerStore.inTransaction(session -> shapes.get(session, shapeId));
    }

    public CurveShape getDefaultCurveShape() {
        return ledgerStore.inTransaction(shapes::getDefault);
    }

    public CurveShape setDefaultCurveShape(String shapeId) {
        return ledgerStore.inTransaction(session -> shapes.setDefault(session, shapeId));
    }

    public CurveShape updateCurveShape(String shapeId, Map<String, Double> params, List<CurvePoint> customPoints) {
        return ledgerStore.inTransaction(session -> shapes.update(session, shapeId, params, customPoints));
    }

    public void deleteCurveShape(String shapeId) {
        ledgerStore.run(session -> shapes.delete(session, shapeId));
    }

    /**
     * Install a rule for one market. {@link OverrideRule.Kind#DEFAULT} removes
     * whatever override the market had.
     */
    public OverrideRule setMarketOverride(String marketId, OverrideRule rule) {
        if (rule == null) {
            throw new InvalidArgumentException("override is required");
        }
        return ledgerStore.inTransaction(session -> {
            session.findMarket(marketId).orElseThrow(() -> new NotFoundException("Market", marketId));
            MarketOverride.MarketOverrideBuilder row = MarketOverride.builder()
                .marketId(marketId)
                .updatedAt(clock.tick());
            switch (rule.getKind()) {
                case DEFAULT -> session.deleteMarketOverride(marketId);
                case DISABLED -> session.saveMarketOverride(row.type(OverrideType.DISABLED).build());
                case REPLACED -> session.saveMarketOverride(row.type(OverrideType.REPLACED)
                    .customCurve(rule.getCurve())
                    .build());
                case MULTIPLIED -> session.saveMarketOverride(row.type(OverrideType.MULTIPLIED)
                    .multiplier(rule.getMultiplier())
                    .build());
            }
            log.info("Market override set: marketId={}, kind={}", marketId, rule.getKind());
            return rule;
        });
    }

    public OverrideRule getMarketOverride(String marketId) {
        return ledgerStore.inTransaction(session -> OverrideRule.from(session.findMarketOverride(marketId).orElse(null)));
    }

    public List<MarketWeight> initializeMarketWeights() {
        return ledgerStore.inTransaction(weights::initialize);
    }

    public List<MarketWeight> listMarketWeights() {
        return ledgerStore.inTransaction(weights::list);
    }

    public List<MarketWeight> setMarketWeight(String marketId, BigDecimal weight, boolean locked) {
        return ledgerStore.inTransaction(session -> {
            weights.setWeight(session, marketId, weight, locked);
            return weights.list(session);
        });
    }

    public List<MarketWeight> setWeightLock(String marketId, boolean locked) {
        return ledgerStore.inTransaction(session -> {
            weights.setLock(session, marketId, locked);
            return weights.list(session);
        });
    }

    public MarketWeight setRelativeOdds(String marketId, BigDecimal odds) {
        return ledgerStore.inTransaction(session -> {
            weights.setRelativeOdds(session, marketId, odds);
            return session.findMarketWeight(marketId).orElseThrow(() -> new NotFoundException("Market weight", marketId));
        });
    }

    public List<MarketWeight> applyRelativeOdds() {
        return ledgerStore.inTransaction(session -> {
            weights.applyRelativeOdds(session);
            return weights.list(session);
        });
    }

    /**
     * @return the target ladder, or {@code null} when the market is disabled for the bot
     */
    public List<LadderPoint> computeEffectiveCurve(String marketId) {
        return ledgerStore.inTransaction(session ->
            shaper.computeEffectiveCurve(session, marketId, botSettings.load(session)));
    }
}
