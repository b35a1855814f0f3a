package com.prediction.market.exchange.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.prediction.market.exchange.bot.BotAnalytics;
import com.prediction.market.exchange.bot.BotConfigPatch;
import com.prediction.market.exchange.bot.BotSettings;
import com.prediction.market.exchange.bot.BotStats;
import com.prediction.market.exchange.bot.DeployAllResult;
import com.prediction.market.exchange.bot.DeploymentOrchestrator;
import com.prediction.market.exchange.bot.DeploymentPreview;
import com.prediction.market.exchange.bot.DeploymentResult;
import com.prediction.market.exchange.bot.WorstCase;
import com.prediction.market.exchange.engine.CancelResult;
import com.prediction.market.exchange.entity.BotActionLog;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.ExposureSnapshot;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.execution.MarketExecutionRegistry;
import com.prediction.market.exchange.ledger.LedgerStore;
import com.prediction.market.exchange.risk.ExposureView;
import com.prediction.market.exchange.risk.PullbackController;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Liquidity bot facade. The configuration is loaded inside each ledger
 * transaction and passed down explicitly.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BotService {

    private final LedgerStore ledgerStore;
    private final BotSettings botSettings;
    private final DeploymentOrchestrator orchestrator;
    private final PullbackController pullbackController;
    private final BotAnalytics analytics;
    private final MarketExecutionRegistry registry;

    public BotConfig getBotConfig() {
        return ledgerStore.inTransaction(botSettings::load);
    }

    public BotConfig updateBotConfig(BotConfigPatch patch) {
        if (patch == null) {
            throw new InvalidArgumentException("config patch is required");
        }
        return ledgerStore.inTransaction(session -> {
            BotConfig updated = botSettings.update(session, patch);
            pullbackController.refresh(session, updated);
            return updated;
        });
    }

    public ExposureView getExposure() {
        return ledgerStore.inTransaction(session -> {
            ExposureSnapshot snapshot = pullbackController.refresh(session, botSettings.load(session));
            return ExposureView.builder()
                .totalAtRisk(snapshot.getTotalAtRisk())
                .tier(snapshot.getTier())
                .lastPullbackAt(snapshot.getLastPullbackAt())
                .build();
        });
    }

    public DeploymentResult deployMarket(String marketId, String fundingAccountId) {
        return MarketRouting.onMarket(ledgerStore, registry, marketId, () -> ledgerStore.inTransaction(session ->
            orchestrator.deployMarket(session, marketId, fundingAccountId, botSettings.load(session))));
    }

    public DeployAllResult deployAllMarkets(String fundingAccountId) {
        return ledgerStore.inTransaction(session ->
            orchestrator.deployAll(session, fundingAccountId, botSettings.load(session)));
    }

    public DeploymentPreview previewDeployment(String fundingAccountId) {
        return ledgerStore.inTransaction(session ->
            orchestrator.preview(session, fundingAccountId, botSettings.current(session)));
    }

    /**
     * Pull every resting bot order from every market.
     */
    public CancelResult withdrawAll() {
        return ledgerStore.inTransaction(session -> {
            BotConfig config = botSettings.load(session);
            CancelResult result = orchestrator.withdrawAll(session, config.getBotAccountId(), config);
            log.info("Bot withdrawn: orders={}, refunded={}", result.getOrders().size(), result.getRefunded());
            return result;
        });
    }

    public BotStats getStats() {
        return ledgerStore.inTransaction(session -> analytics.stats(session, botSettings.load(session)));
    }

    public WorstCase getWorstCase() {
        return ledgerStore.inTransaction(session -> analytics.worstCase(session, botSettings.load(session)));
    }

    public List<BotActionLog> getActivityLog(int limit) {
        if (limit < 1) {
            throw new InvalidArgumentException("limit must be positive");
        }
        return ledgerStore.inTransaction(session -> session.findRecentBotActions(limit));
    }
}
