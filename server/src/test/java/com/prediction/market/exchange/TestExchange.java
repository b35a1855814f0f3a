package com.prediction.market.exchange;

import java.math.BigDecimal;
import java.time.Instant;

import com.prediction.market.exchange.bot.BotAnalytics;
import com.prediction.market.exchange.bot.BotSettings;
import com.prediction.market.exchange.bot.DeploymentOrchestrator;
import com.prediction.market.exchange.config.ExchangeProperties;
import com.prediction.market.exchange.engine.CostModel;
import com.prediction.market.exchange.engine.MarketSettlement;
import com.prediction.market.exchange.engine.MatchingEngine;
import com.prediction.market.exchange.engine.PositionNetting;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.execution.MarketExecutionRegistry;
import com.prediction.market.exchange.ledger.InMemoryLedgerStore;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.liquidity.CurveShapeLibrary;
import com.prediction.market.exchange.liquidity.LiquidityShaper;
import com.prediction.market.exchange.liquidity.MarketWeightBalancer;
import com.prediction.market.exchange.risk.ExposureTracker;
import com.prediction.market.exchange.risk.PullbackController;
import com.prediction.market.exchange.service.BalanceService;
import com.prediction.market.exchange.service.BotService;
import com.prediction.market.exchange.service.LedgerAudit;
import com.prediction.market.exchange.service.LiquidityService;
import com.prediction.market.exchange.service.OrderValidator;
import com.prediction.market.exchange.service.ResolutionService;
import com.prediction.market.exchange.service.TradingService;

/**
 * The whole exchange wired by hand over the in-memory ledger, as the Spring
 * configuration wires it. The bot runs with a max loss of 100,000, total
 * liquidity of 100,000 and 10% tiers.
 */
public class TestExchange {

    public static final String BOT = "liquidity-bot";
    public static final long MAX_LOSS = 100_000L;

    public final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    public final LedgerClock ledgerClock = new LedgerClock(clock);
    public final InMemoryLedgerStore store = new InMemoryLedgerStore();
    public final ExchangeProperties properties = new ExchangeProperties();

    public final CostModel costModel = new CostModel(1000);
    public final PositionNetting netting = new PositionNetting(costModel, ledgerClock);
    public final MatchingEngine engine = new MatchingEngine(costModel, netting, ledgerClock);
    public final MarketSettlement settlement = new MarketSettlement(costModel, engine, ledgerClock);
    public final ExposureTracker tracker = new ExposureTracker(costModel);
    public final PullbackController pullback = new PullbackController(tracker, ledgerClock);
    public final CurveShapeLibrary shapes = new CurveShapeLibrary(ledgerClock);
    public final MarketWeightBalancer weights = new MarketWeightBalancer(ledgerClock);
    public final LiquidityShaper shaper = new LiquidityShaper(costModel, tracker, shapes, weights);
    public final BotSettings botSettings;
    public final DeploymentOrchestrator orchestrator = new DeploymentOrchestrator(engine, shaper, pullback,
        ledgerClock);
    public final BotAnalytics analytics = new BotAnalytics(pullback);
    public final MarketExecutionRegistry registry = new MarketExecutionRegistry();

    public final OrderValidator validator;
    public final TradingService trading;
    public final ResolutionService resolution;
    public final LiquidityService liquidity;
    public final BotService bot;
    public final BalanceService balances;
    public final LedgerAudit audit;

    public TestExchange() {
        this(true);
    }

    public TestExchange(boolean botActive) {
        botSettings = new BotSettings(BotConfig.builder()
            .id(BotConfig.SINGLETON_ID)
            .botAccountId(BOT)
            .maxLoss(MAX_LOSS)
            .totalLiquidity(MAX_LOSS)
            .tierWidthPercent(10)
            .globalMultiplier(BigDecimal.ONE)
            .minOrderShares(1)
            .active(botActive)
            .build(), ledgerClock);
        validator = new OrderValidator(costModel, properties);
        trading = new TradingService(store, engine, pullback, botSettings, validator, registry, ledgerClock);
        resolution = new ResolutionService(store, settlement, pullback, botSettings, registry, ledgerClock,
            properties);
        liquidity = new LiquidityService(store, shapes, weights, shaper, botSettings, ledgerClock);
        bot = new BotService(store, botSettings, orchestrator, pullback, analytics, registry);
        balances = new BalanceService(store);
        audit = new LedgerAudit(store, costModel);
    }

    /**
     * Seed the bot config and account, then fund the bot.
     */
    public void fundBot(long amount) {
        store.run(botSettings::load);
        trading.deposit(BOT, amount);
    }

    public void shutdown() {
        registry.shutdown();
    }
}
