package com.prediction.market.exchange.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.TestExchange;
import com.prediction.market.exchange.engine.ResolutionResult;
import com.prediction.market.exchange.entity.MarketStatus;
import com.prediction.market.exchange.entity.ResolutionLog;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.InvalidStateException;

/**
 * Two-phase resolution, direct resolution and cancellation of a market in
 * which alice sold 10 YES shares to bob at 600.
 */
class ResolutionServiceTest {

    private static final String MARKET = "m1";

    private TestExchange exchange;
    private ResolutionService resolution;

    @BeforeEach
    void setUp() {
        exchange = new TestExchange(false);
        resolution = exchange.resolution;
        exchange.trading.createMarket(MARKET, "Will it rain?");
        exchange.trading.openAccount("alice", 100_000);
        exchange.trading.openAccount("bob", 100_000);
        exchange.trading.placeOrder("alice", MARKET, Side.NO, 400, 10);
        exchange.trading.placeOrder("bob", MARKET, Side.YES, 700, 10);
        // Left resting
        exchange.trading.placeOrder("alice", MARKET, Side.NO, 100, 5);
    }

    @AfterEach
    void tearDown() {
        exchange.shutdown();
    }

    private long balance(String account) {
        return exchange.trading.getAccount(account).getBalance();
    }

    @Test
    void confirmationWaitsForTheScheduledTime() {
        // Given
        ResolutionLog initiated = resolution.initiateResolution(MARKET, Side.YES, "rain observed");
        assertThat(initiated.getScheduledAt())
            .isEqualTo(Instant.parse("2026-01-02T00:00:00Z").toEpochMilli());
        assertThat(exchange.trading.getMarket(MARKET).getStatus()).isEqualTo(MarketStatus.PENDING_RESOLUTION);

        // When / Then: trading is halted and an early confirmation is refused
        assertThatThrownBy(() -> exchange.trading.placeOrder("bob", MARKET, Side.YES, 500, 1))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> resolution.confirmResolution(MARKET, false))
            .isInstanceOf(InvalidStateException.class)
            .hasMessageContaining("scheduled");

        exchange.clock.advance(Duration.ofHours(25));
        ResolutionResult result = resolution.confirmResolution(MARKET, false);

        assertThat(result.getStatus()).isEqualTo(MarketStatus.RESOLVED);
        assertThat(result.getOutcome()).isEqualTo(Side.YES);
        assertThat(result.getPositionsClosed()).isEqualTo(1);
        assertThat(result.getPaidOut()).isEqualTo(10_000);
        assertThat(result.getOrdersCancelled()).isEqualTo(1);
        assertThat(balance("bob")).isEqualTo(104_000);
        assertThat(balance("alice")).isEqualTo(96_000);
    }

    @Test
    void emergencyConfirmationSkipsTheDelay() {
        resolution.initiateResolution(MARKET, Side.NO, null);

        ResolutionResult result = resolution.confirmResolution(MARKET, true);

        assertThat(result.getOutcome()).isEqualTo(Side.NO);
        assertThat(exchange.trading.getMarket(MARKET).getStatus()).isEqualTo(MarketStatus.RESOLVED);
        assertThat(balance("alice")).isEqualTo(106_000);
    }

    @Test
    void abortReopensTheMarket() {
        resolution.initiateResolution(MARKET, Side.YES, null);

        resolution.abortResolution(MARKET);

        assertThat(exchange.trading.getMarket(MARKET).getStatus()).isEqualTo(MarketStatus.OPEN);
        assertThat(exchange.trading.placeOrder("bob", MARKET, Side.YES, 950, 1).getFilledShares()).isEqualTo(1);
        assertThatThrownBy(() -> resolution.confirmResolution(MARKET, true))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> resolution.abortResolution(MARKET))
            .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void onlyAnOpenMarketCanEnterResolution() {
        resolution.initiateResolution(MARKET, Side.YES, null);

        assertThatThrownBy(() -> resolution.initiateResolution(MARKET, Side.NO, null))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> resolution.initiateResolution(MARKET, null, null))
            .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void marketResolvesOnlyOnce() {
        resolution.resolveMarket(MARKET, Side.YES);

        assertThatThrownBy(() -> resolution.resolveMarket(MARKET, Side.NO))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> resolution.cancelMarket(MARKET))
            .isInstanceOf(InvalidStateException.class);
        assertThat(balance("bob")).isEqualTo(104_000);
    }

    @Test
    void resolvedMarketReleasesItsWorker() {
        // Given
        assertThat(exchange.registry.size()).isEqualTo(1);

        // When
        resolution.resolveMarket(MARKET, Side.NO);

        // Then: later work is still rejected, without a worker thread
        assertThat(exchange.registry.size()).isZero();
        assertThat(exchange.registry.isRetired(MARKET)).isTrue();
        assertThatThrownBy(() -> exchange.trading.placeOrder("bob", MARKET, Side.YES, 500, 1))
            .isInstanceOf(InvalidStateException.class);
        assertThatThrownBy(() -> resolution.cancelMarket(MARKET))
            .isInstanceOf(InvalidStateException.class);
        assertThat(exchange.registry.size()).isZero();
    }

    @Test
    void cancelledMarketReleasesItsWorker() {
        // When
        resolution.cancelMarket(MARKET);

        // Then
        assertThat(exchange.registry.size()).isZero();
        assertThat(exchange.registry.isRetired(MARKET)).isTrue();
    }

    @Test
    void cancelledMarketReturnsEveryStake() {
        ResolutionResult result = resolution.cancelMarket(MARKET);

        assertThat(result.getStatus()).isEqualTo(MarketStatus.CANCELLED);
        assertThat(result.getOutcome()).isNull();
        assertThat(result.getPaidOut()).isEqualTo(10_000);
        assertThat(balance("alice")).isEqualTo(100_000);
        assertThat(balance("bob")).isEqualTo(100_000);
        assertThat(exchange.trading.getOpenOrders("alice")).isEmpty();
    }
}
