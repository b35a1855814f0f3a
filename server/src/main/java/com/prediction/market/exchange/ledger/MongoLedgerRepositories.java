package com.prediction.market.exchange.ledger;

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

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The Spring Data repositories the Mongo ledger reads and writes through.
 */
@Getter
@RequiredArgsConstructor
public class MongoLedgerRepositories {

    private final AccountRepository accounts;
    private final MarketRepository markets;
    private final OrderRepository orders;
    private final PositionRepository positions;
    private final TransactionRepository transactions;
    private final ExposureSnapshotRepository exposure;
    private final BotConfigRepository botConfig;
    private final MarketWeightRepository marketWeights;
    private final CurveShapeRepository curveShapes;
    private final MarketOverrideRepository overrides;
    private final BotActionLogRepository botActions;
    private final ResolutionLogRepository resolutionLogs;
}
