package com.prediction.market.exchange.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class ExchangePropertiesBindingTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withUserConfiguration(TestConfig.class);

    @Test
    void defaultsApplyWithoutProperties() {
        runner.run(context -> {
            ExchangeProperties properties = context.getBean(ExchangeProperties.class);

            assertThat(properties.getLedger().getStore()).isEqualTo(ExchangeProperties.StoreType.MEMORY);
            assertThat(properties.getMatching().getPayoutUnit()).isEqualTo(1000);
            assertThat(properties.getBot().isActive()).isFalse();
            assertThat(properties.getResolution().getDelay()).isEqualTo(Duration.ofHours(24));
        });
    }

    @Test
    void bindsNestedGroupsFromRelaxedProperties() {
        runner.withPropertyValues(
                "exchange.ledger.store=mongo",
                "exchange.ledger.reconcile-interval=30s",
                "exchange.ledger.retry.max-attempts=3",
                "exchange.matching.payout-unit=100",
                "exchange.bot.account-id=maker-1",
                "exchange.bot.max-loss=50000",
                "exchange.bot.tier-width-percent=5",
                "exchange.bot.global-multiplier=0.75",
                "exchange.bot.active=true",
                "exchange.resolution.delay=2h",
                "exchange.rate-limit.limit-for-period=3",
                "exchange.rate-limit.refresh-period=1m",
                "exchange.rate-limit.exempted-paths=/actuator/,/api/markets")
            .run(context -> {
                ExchangeProperties properties = context.getBean(ExchangeProperties.class);

                assertThat(properties.getLedger().getStore()).isEqualTo(ExchangeProperties.StoreType.MONGO);
                assertThat(properties.getLedger().getReconcileInterval()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.getLedger().getRetry().getMaxAttempts()).isEqualTo(3);
                assertThat(properties.getMatching().getPayoutUnit()).isEqualTo(100);

                ExchangeProperties.Bot bot = properties.getBot();
                assertThat(bot.getAccountId()).isEqualTo("maker-1");
                assertThat(bot.getMaxLoss()).isEqualTo(50_000);
                assertThat(bot.getTierWidthPercent()).isEqualTo(5);
                assertThat(bot.getGlobalMultiplier()).isEqualByComparingTo(new BigDecimal("0.75"));
                assertThat(bot.isActive()).isTrue();

                assertThat(properties.getResolution().getDelay()).isEqualTo(Duration.ofHours(2));

                ExchangeProperties.RateLimit rateLimit = properties.getRateLimit();
                assertThat(rateLimit.getLimitForPeriod()).isEqualTo(3);
                assertThat(rateLimit.getRefreshPeriod()).isEqualTo(Duration.ofMinutes(1));
                assertThat(rateLimit.getExemptedPaths()).containsExactly("/actuator/", "/api/markets");
            });
    }

    @Test
    void rejectsOutOfRangeValues() {
        runner.withPropertyValues("exchange.bot.tier-width-percent=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(ExchangeProperties.class)
    static class TestConfig {
    }
}
