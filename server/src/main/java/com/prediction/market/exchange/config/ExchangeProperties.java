package com.prediction.market.exchange.config;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "exchange")
public class ExchangeProperties {

    @Valid
    private Ledger ledger = new Ledger();

    @Valid
    private Matching matching = new Matching();

    @Valid
    private Bot bot = new Bot();

    @Valid
    private Resolution resolution = new Resolution();

    @Valid
    private RateLimit rateLimit = new RateLimit();

    public enum StoreType {
        MEMORY,
        MONGO
    }

    @Getter
    @Setter
    public static class Ledger {
        @NotNull
        private StoreType store = StoreType.MEMORY;

        @Valid
        private Retry retry = new Retry();

        /**
         * Interval of the balance reconciliation job.
         */
        private Duration reconcileInterval = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Retry {
        @Min(1)
        private int maxAttempts = 5;

        @Min(0)
        private long initialBackoffMillis = 10;

        @Min(0)
        private long maxBackoffMillis = 200;
    }

    @Getter
    @Setter
    public static class Matching {
        /**
         * What one winning share pays. Order prices lie in [1, payoutUnit - 1].
         */
        @Min(2)
        private int payoutUnit = 1000;

        @Min(1)
        private int maxShares = 1_000_000;
    }

    @Getter
    @Setter
    public static class Bot {
        @NotBlank
        private String accountId = "liquidity-bot";

        @Min(1)
        private long maxLoss = 10_000_000L;

        /**
         * Liquidity budget across all markets. Times the global multiplier it may not exceed {@code maxLoss}.
         */
        @Min(0)
        private long totalLiquidity = 10_000_000L;

        @Min(1)
        @Max(100)
        private int tierWidthPercent = 10;

        @NotNull
        @DecimalMin("0")
        private BigDecimal globalMultiplier = BigDecimal.ONE;

        @Min(1)
        private int minOrderShares = 1;

        private boolean active = false;
    }

    @Getter
    @Setter
    public static class Resolution {
        /**
         * Wait between initiating and confirming a resolution.
         */
        @NotNull
        private Duration delay = Duration.ofHours(24);
    }

    /**
     * Per-caller API limits: {@code limitForPeriod} requests every {@code refreshPeriod}.
     */
    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;

        @Min(1)
        private int limitForPeriod = 10;

        @NotNull
        private Duration refreshPeriod = Duration.ofSeconds(1);

        private List<String> exemptedPaths = new ArrayList<>();
    }
}
