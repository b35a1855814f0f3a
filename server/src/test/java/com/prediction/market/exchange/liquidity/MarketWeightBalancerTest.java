package com.prediction.market.exchange.liquidity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.TestExchange;
import com.prediction.market.exchange.entity.MarketWeight;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;

class MarketWeightBalancerTest {

    private TestExchange exchange;

    @BeforeEach
    void setUp() {
        exchange = new TestExchange(false);
        exchange.trading.createMarket("m1", "One");
        exchange.trading.createMarket("m2", "Two");
        exchange.trading.createMarket("m3", "Three");
    }

    @AfterEach
    void tearDown() {
        exchange.shutdown();
    }

    private static BigDecimal total(List<MarketWeight> weights) {
        return weights.stream().map(MarketWeight::getWeight).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static Map<String, BigDecimal> byMarket(List<MarketWeight> weights) {
        return weights.stream().collect(Collectors.toMap(MarketWeight::getMarketId, MarketWeight::getWeight));
    }

    @Test
    void initializeSharesEquallyAndSumsToExactlyOne() {
        List<MarketWeight> weights = exchange.liquidity.initializeMarketWeights();

        assertThat(weights).hasSize(3);
        assertThat(total(weights)).isEqualByComparingTo(BigDecimal.ONE);
        assertThat(weights).allSatisfy(w ->
            assertThat(w.getWeight()).isBetween(new BigDecimal("0.333333333333"), new BigDecimal("0.333333333334")));
    }

    @Test
    void lockedWeightLeavesTheRestToUnlockedMarkets() {
        exchange.liquidity.initializeMarketWeights();

        List<MarketWeight> weights = exchange.liquidity.setMarketWeight("m1", new BigDecimal("0.5"), true);

        Map<String, BigDecimal> map = byMarket(weights);
        assertThat(map.get("m1")).isEqualByComparingTo("0.5");
        assertThat(map.get("m2")).isEqualByComparingTo("0.25");
        assertThat(map.get("m3")).isEqualByComparingTo("0.25");
        assertThat(total(weights)).isEqualByComparingTo(BigDecimal.ONE);
        assertThat(weights.get(0).getMarketId()).isEqualTo("m1");
    }

    @Test
    void unlockedChangeIsSpreadProportionally() {
        exchange.liquidity.initializeMarketWeights();
        exchange.liquidity.setMarketWeight("m1", new BigDecimal("0.5"), true);
        exchange.liquidity.setWeightLock("m1", false);

        // m2 from 0.25 to 0.45 unlocked: the 0.2 comes out of m1 and m3 by weight
        List<MarketWeight> weights = exchange.liquidity.setMarketWeight("m2", new BigDecimal("0.45"), false);

        Map<String, BigDecimal> map = byMarket(weights);
        assertThat(total(weights)).isEqualByComparingTo(BigDecimal.ONE);
        assertThat(map.get("m1")).isLessThan(new BigDecimal("0.5"));
        assertThat(map.get("m3")).isLessThan(new BigDecimal("0.25"));
        assertThat(map.get("m1")).isGreaterThan(map.get("m3"));
    }

    @Test
    void relativeOddsDriveUnlockedWeights() {
        exchange.liquidity.initializeMarketWeights();
        exchange.liquidity.setRelativeOdds("m1", new BigDecimal("2"));
        exchange.liquidity.setRelativeOdds("m2", new BigDecimal("1"));
        exchange.liquidity.setRelativeOdds("m3", new BigDecimal("1"));

        Map<String, BigDecimal> map = byMarket(exchange.liquidity.applyRelativeOdds());

        assertThat(map.get("m1")).isEqualByComparingTo("0.5");
        assertThat(map.get("m2")).isEqualByComparingTo("0.25");
        assertThat(map.get("m3")).isEqualByComparingTo("0.25");
    }

    @Test
    void resolvedMarketsDropOutOfTheBudget() {
        exchange.liquidity.initializeMarketWeights();
        exchange.resolution.resolveMarket("m3", Side.NO);

        List<MarketWeight> weights = exchange.liquidity.listMarketWeights();

        assertThat(weights).extracting(MarketWeight::getMarketId).containsExactlyInAnyOrder("m1", "m2");
        assertThatThrownBy(() -> exchange.liquidity.setMarketWeight("m3", BigDecimal.ONE, false))
            .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void invalidInputsAreRejected() {
        exchange.liquidity.initializeMarketWeights();

        assertThatThrownBy(() -> exchange.liquidity.setMarketWeight("m1", null, false))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> exchange.liquidity.setMarketWeight("missing", BigDecimal.ONE, false))
            .isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> exchange.liquidity.setRelativeOdds("m1", new BigDecimal("-1")))
            .isInstanceOf(InvalidArgumentException.class);
    }
}
