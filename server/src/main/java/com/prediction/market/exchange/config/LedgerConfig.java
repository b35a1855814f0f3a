package com.prediction.market.exchange.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.prediction.market.exchange.ledger.InMemoryLedgerStore;
import com.prediction.market.exchange.ledger.LedgerRetryPolicy;
import com.prediction.market.exchange.ledger.LedgerStore;
import com.prediction.market.exchange.ledger.MongoLedgerRepositories;
import com.prediction.market.exchange.ledger.MongoLedgerStore;
import com.prediction.market.exchange.repositories.AccountRepository;
import com.prediction.market.exchange.repositories.BotActionLogRepository;
import com.prediction.market.exchange.repositories.BotConfigRepository;
import com.prediction.market.exchange.repositories.CurveShapeRepository;
import com.prediction.market.exchange.repositories.ExposureSnapshotRepository;
import com.prediction.market.exchange.repositories.MarketOverrideRepository;
import com.prediction.market.exchange.repositories.MarketRepository;
import com.prediction.market.exchange.repositories.MarketWeightRepository;
import com.prediction.market.exchange.repositories.OrderRepository;
import com.prediction.market.exchange.repositories.PositionRepository;
import com.prediction.market.exchange.repositories.ResolutionLogRepository;
import com.prediction.market.exchange.repositories.TransactionRepository;

/**
 * Picks the ledger adapter from {@code exchange.ledger.store}.
 */
@Configuration
public class LedgerConfig {

    @Bean
    @ConditionalOnProperty(prefix = "exchange.ledger", name = "store", havingValue = "memory", matchIfMissing = true)
    LedgerStore inMemoryLedgerStore() {
        return new InMemoryLedgerStore();
    }

    @Configuration
    @ConditionalOnProperty(prefix = "exchange.ledger", name = "store", havingValue = "mongo")
    static class MongoLedgerConfig {

        // Multi-document transactions need a replica set.
        @Bean
        MongoTransactionManager mongoTransactionManager(MongoDatabaseFactory databaseFactory) {
            return new MongoTransactionManager(databaseFactory);
        }

        @Bean
        MongoLedgerRepositories mongoLedgerRepositories(AccountRepository accounts, MarketRepository markets,
                OrderRepository orders, PositionRepository positions, TransactionRepository transactions,
                ExposureSnapshotRepository exposure, BotConfigRepository botConfig,
                MarketWeightRepository marketWeights, CurveShapeRepository curveShapes,
                MarketOverrideRepository overrides, BotActionLogRepository botActions,
                ResolutionLogRepository resolutionLogs) {
            return new MongoLedgerRepositories(accounts, markets, orders, positions, transactions, exposure,
                botConfig, marketWeights, curveShapes, overrides, botActions, resolutionLogs);
        }

        @Bean
        LedgerStore mongoLedgerStore(MongoTransactionManager transactionManager,
                MongoLedgerRepositories repositories, ExchangeProperties properties) {
            ExchangeProperties.Retry retry = properties.getLedger().getRetry();
            return new MongoLedgerStore(new TransactionTemplate(transactionManager), repositories,
                new LedgerRetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoffMillis(),
                    retry.getMaxBackoffMillis()));
        }
    }
}
