package com.prediction.market.exchange.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.error.InvalidStateException;

class MarketExecutionRegistryTest {

    private final MarketExecutionRegistry registry = new MarketExecutionRegistry();

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void runsWorkOnTheMarketThread() {
        // When
        String thread = registry.execute("m1", () -> Thread.currentThread().getName());

        // Then
        assertThat(thread).isEqualTo("market-m1");
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void exceptionsSurfaceUnwrapped() {
        assertThatThrownBy(() -> registry.execute("m1", () -> {
            throw new InvalidStateException("closed");
        })).isInstanceOf(InvalidStateException.class).hasMessage("closed");
    }

    @Test
    void retiredMarketRunsOnTheCallerWithoutAWorker() {
        // Given
        registry.execute("m1", () -> 1);

        // When
        registry.retire("m1");
        String thread = registry.execute("m1", () -> Thread.currentThread().getName());

        // Then
        assertThat(thread).isEqualTo(Thread.currentThread().getName());
        assertThat(registry.size()).isZero();
        assertThat(registry.isRetired("m1")).isTrue();
        assertThat(registry.isRetired("m2")).isFalse();
    }
}
