package com.prediction.market.exchange.config;

import java.time.Clock;

import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import com.prediction.market.exchange.bot.BotAnalytics;
import com.prediction.market.exchange.bot.BotSettings;
import com.prediction.market.exchange.bot.DeploymentOrchestrator;
import com.prediction.market.exchange.engine.CostModel;
import com.prediction.market.exchange.engine.MarketSettlement;
import com.prediction.market.exchange.engine.MatchingEngine;
import com.prediction.market.exchange.engine.PositionNetting;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerStore;
import com.prediction.market.exchange.liquidity.CurveShapeLibrary;
import com.prediction.market.exchange.liquidity.LiquidityShaper;
import com.prediction.market.exchange.liquidity.MarketWeightBalancer;
import com.prediction.market.exchange.risk.ExposureTracker;
import com.prediction.market.exchange.risk.PullbackController;

/**
 * Engine, risk and liquidity components. They are plain classes; the
 * services pass the ledger session and bot configuration into every call.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(ExchangeProperties.class)
public class ExchangeConfig {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    LedgerClock ledgerClock(Clock clock) {
        return new LedgerClock(clock);
    }

    @Bean
    CostModel costModel(ExchangeProperties properties) {
        return new CostModel(properties.getMatching().getPayoutUnit());
    }

    @Bean
    PositionNetting positionNetting(CostModel costModel, LedgerClock ledgerClock) {
        return new PositionNetting(costModel, ledgerClock);
    }

    @Bean
    MatchingEngine matchingEngine(CostModel costModel, PositionNetting positionNetting, LedgerClock ledgerClock) {
        return new MatchingEngine(costModel, positionNetting, ledgerClock);
    }

    @Bean
    MarketSettlement marketSettlement(CostModel costModel, MatchingEngine matchingEngine, LedgerClock ledgerClock) {
        return new MarketSettlement(costModel, matchingEngine, ledgerClock);
    }

    @Bean
    ExposureTracker exposureTracker(CostModel costModel) {
        return new ExposureTracker(costModel);
    }

    @Bean
    PullbackController pullbackController(ExposureTracker exposureTracker, LedgerClock ledgerClock) {
        return new PullbackController(exposureTracker, ledgerClock);
    }

    @Bean
    CurveShapeLibrary curveShapeLibrary(LedgerClock ledgerClock) {
        return new CurveShapeLibrary(ledgerClock);
    }

    @Bean
    MarketWeightBalancer marketWeightBalancer(LedgerClock ledgerClock) {
        return new MarketWeightBalancer(ledgerClock);
    }

    @Bean
    LiquidityShaper liquidityShaper(CostModel costModel, ExposureTracker exposureTracker,
            CurveShapeLibrary curveShapeLibrary, MarketWeightBalancer marketWeightBalancer) {
        return new LiquidityShaper(costModel, exposureTracker, curveShapeLibrary, marketWeightBalancer);
    }

    @Bean
    BotSettings botSettings(ExchangeProperties properties, LedgerClock ledgerClock) {
        ExchangeProperties.Bot bot = properties.getBot();
        BotConfig defaults = BotConfig.builder()
            .id(BotConfig.SINGLETON_ID)
            .botAccountId(bot.getAccountId())
            .maxLoss(bot.getMaxLoss())
            .totalLiquidity(bot.getTotalLiquidity())
            .tierWidthPercent(bot.getTierWidthPercent())
            .globalMultiplier(bot.getGlobalMultiplier())
            .minOrderShares(bot.getMinOrderShares())
            .active(bot.isActive())
            .build();
        return new BotSettings(defaults, ledgerClock);
    }

    @Bean
    DeploymentOrchestrator deploymentOrchestrator(MatchingEngine matchingEngine, LiquidityShaper liquidityShaper,
            PullbackController pullbackController, LedgerClock ledgerClock) {
        return new DeploymentOrchestrator(matchingEngine, liquidityShaper, pullbackController, ledgerClock);
    }

    @Bean
    BotAnalytics botAnalytics(PullbackController pullbackController) {
        return new BotAnalytics(pullbackController);
    }

    /**
     * Seeds the bot config, the bot account and the default curve shape so
     * that read paths find them in place.
     */
    @Bean
    ApplicationRunner exchangeSeeder(LedgerStore ledgerStore, BotSettings botSettings,
            CurveShapeLibrary curveShapeLibrary) {
        return args -> ledgerStore.run(session -> {
            botSettings.load(session);
            curveShapeLibrary.getDefault(session);
        });
    }
}
