package com.prediction.market.exchange.liquidity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.TestExchange;
import com.prediction.market.exchange.bot.BotConfigPatch;
import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.entity.CurveShape;
import com.prediction.market.exchange.entity.ShapeType;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;

class LiquidityShaperTest {

    private static final String MARKET = "m1";

    private TestExchange exchange;

    @BeforeEach
    void setUp() {
        // A single open market owns the whole budget of 100,000
        exchange = new TestExchange(false);
        exchange.trading.createMarket(MARKET, "Only market");
        exchange.liquidity.initializeMarketWeights();
        CurveShape flat = exchange.liquidity.saveCurveShape("Flat", ShapeType.FLAT, null, null);
        exchange.liquidity.setDefaultCurveShape(flat.getId());
    }

    @AfterEach
    void tearDown() {
        exchange.shutdown();
    }

    @Test
    void flatShapeSpreadsTheBudgetOverTheLadder() {
        List<LadderPoint> ladder = exchange.liquidity.computeEffectiveCurve(MARKET);

        // 100,000 × 0.1 per point = 10 shares of payout 1000
        assertThat(ladder).hasSize(10);
        assertThat(ladder).extracting(LadderPoint::getPrice)
            .containsExactly(50, 100, 150, 200, 250, 300, 350, 400, 450, 500);
        assertThat(ladder).allSatisfy(point -> {
            assertThat(point.getShares()).isEqualTo(10);
            assertThat(point.getAmount()).isEqualTo(10_000);
            assertThat(point.getNoPrice()).isEqualTo(1000 - point.getPrice());
        });
    }

    @Test
    void multipliersScaleSizes() {
        exchange.bot.updateBotConfig(BotConfigPatch.builder().globalMultiplier(new BigDecimal("0.5")).build());
        exchange.liquidity.setMarketOverride(MARKET, OverrideRule.multiplied(new BigDecimal("0.4")));

        List<LadderPoint> ladder = exchange.liquidity.computeEffectiveCurve(MARKET);

        // 10,000 × 0.5 × 0.4 = 2,000 per point
        assertThat(ladder).allSatisfy(point -> assertThat(point.getShares()).isEqualTo(2));
    }

    @Test
    void pointsBelowMinimumOrderSizeAreDropped() {
        exchange.bot.updateBotConfig(BotConfigPatch.builder().minOrderShares(11).build());

        assertThat(exchange.liquidity.computeEffectiveCurve(MARKET)).isEmpty();
    }

    @Test
    void exposureShrinksTheLadder() {
        // Given: the bot short 30 shares, 30% of max loss
        exchange.fundBot(100_000);
        exchange.trading.openAccount("alice", 100_000);
        exchange.trading.placeOrder(TestExchange.BOT, MARKET, Side.NO, 500, 30);
        exchange.trading.placeOrder("alice", MARKET, Side.YES, 500, 30);

        List<LadderPoint> ladder = exchange.liquidity.computeEffectiveCurve(MARKET);

        // 10,000 × 0.7 = 7,000 per point
        assertThat(ladder).allSatisfy(point -> assertThat(point.getShares()).isEqualTo(7));
    }

    @Test
    void replacedCurveUsesItsOwnPoints() {
        exchange.liquidity.setMarketOverride(MARKET,
            OverrideRule.replaced(List.of(new CurvePoint(40, 1), new CurvePoint(10, 3))));

        List<LadderPoint> ladder = exchange.liquidity.computeEffectiveCurve(MARKET);

        assertThat(ladder).extracting(LadderPoint::getPrice).containsExactly(100, 400);
        assertThat(ladder).extracting(LadderPoint::getShares).containsExactly(75, 25);
    }

    @Test
    void disabledMarketHasNoCurveAndDefaultRestoresIt() {
        exchange.liquidity.setMarketOverride(MARKET, OverrideRule.disabled());
        assertThat(exchange.liquidity.computeEffectiveCurve(MARKET)).isNull();
        assertThat(exchange.liquidity.getMarketOverride(MARKET).isDisabled()).isTrue();

        exchange.liquidity.setMarketOverride(MARKET, OverrideRule.defaultRule());
        assertThat(exchange.liquidity.computeEffectiveCurve(MARKET)).hasSize(10);
        assertThat(exchange.liquidity.getMarketOverride(MARKET).getKind()).isEqualTo(OverrideRule.Kind.DEFAULT);
    }

    @Test
    void marketWithoutWeightGetsNothing() {
        exchange.trading.createMarket("m2", "No weight yet");

        assertThat(exchange.liquidity.computeEffectiveCurve("m2")).isEmpty();
        assertThatThrownBy(() -> exchange.liquidity.computeEffectiveCurve("missing"))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void defaultShapeCannotBeDeleted() {
        CurveShape current = exchange.liquidity.getDefaultCurveShape();
        CurveShape other = exchange.liquidity.saveCurveShape("Steep", ShapeType.EXPONENTIAL, null, null);

        assertThatThrownBy(() -> exchange.liquidity.deleteCurveShape(current.getId()))
            .isInstanceOf(InvalidStateException.class);
        exchange.liquidity.deleteCurveShape(other.getId());
        assertThat(exchange.liquidity.listCurveShapes()).extracting(CurveShape::getName).doesNotContain("Steep");
    }

    @Test
    void updateMergesParametersAndRegeneratesPoints() {
        CurveShape bell = exchange.liquidity.saveCurveShape("Bell", ShapeType.BELL, null, null);

        CurveShape updated = exchange.liquidity.updateCurveShape(bell.getId(), Map.of("mu", 45.0), null);

        assertThat(updated.getParams()).containsEntry("mu", 45.0).containsEntry("sigma", 15.0);
        CurvePoint top = updated.getPoints().stream()
            .max((a, b) -> Double.compare(a.getWeight(), b.getWeight()))
            .orElseThrow();
        assertThat(top.getPrice()).isEqualTo(45);
    }
}
