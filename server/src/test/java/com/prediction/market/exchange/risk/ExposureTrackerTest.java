package com.prediction.market.exchange.risk;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.engine.CostModel;
import com.prediction.market.exchange.entity.BotConfig;

class ExposureTrackerTest {

    private final ExposureTracker tracker = new ExposureTracker(new CostModel(1000));

    private static BotConfig config(long maxLoss, int tierWidthPercent) {
        return BotConfig.builder()
            .botAccountId("bot")
            .maxLoss(maxLoss)
            .tierWidthPercent(tierWidthPercent)
            .globalMultiplier(BigDecimal.ONE)
            .minOrderShares(1)
            .build();
    }

    @Test
    void tiersAreFixedWidthBandsOfMaxLoss() {
        BotConfig config = config(100_000, 10);

        assertThat(tracker.tier(0, config)).isZero();
        assertThat(tracker.tier(9_999, config)).isZero();
        assertThat(tracker.tier(10_000, config)).isEqualTo(1);
        assertThat(tracker.tier(95_000, config)).isEqualTo(9);
        assertThat(tracker.tier(105_000, config)).isEqualTo(10);
        assertThat(tracker.tier(50_000, config(100_000, 25))).isEqualTo(2);
    }

    @Test
    void ratioIsLinearAndZeroAtMaxLoss() {
        assertThat(tracker.pullbackRatio(0, 100_000)).isEqualByComparingTo("1");
        assertThat(tracker.pullbackRatio(25_000, 100_000)).isEqualByComparingTo("0.75");
        assertThat(tracker.pullbackRatio(100_000, 100_000)).isEqualByComparingTo("0");
        assertThat(tracker.pullbackRatio(150_000, 100_000)).isEqualByComparingTo("0");
    }

    @Test
    void scaleFloorsExactly() {
        assertThat(tracker.scale(80, 20_000, 100_000)).isEqualTo(64);
        assertThat(tracker.scale(7, 33_333, 100_000)).isEqualTo(4);
        assertThat(tracker.scale(1_000, 99_999, 100_000)).isZero();
        assertThat(tracker.scale(1_000, 100_000, 100_000)).isZero();
    }

    @Test
    void headroomNeverNegative() {
        assertThat(tracker.headroom(40_000, 100_000)).isEqualTo(60_000);
        assertThat(tracker.headroom(140_000, 100_000)).isZero();
    }
}
