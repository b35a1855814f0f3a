package com.prediction.market.exchange.ledger;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.BotActionLog;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.CurveShape;
import com.prediction.market.exchange.entity.ExposureSnapshot;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.MarketOverride;
import com.prediction.market.exchange.entity.MarketStatus;
import com.prediction.market.exchange.entity.MarketWeight;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.ResolutionAction;
import com.prediction.market.exchange.entity.ResolutionLog;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.entity.Transaction;

class InMemoryLedgerSession implements LedgerSession {

    private static final Comparator<Order> BOOK_ORDER = Comparator.comparingInt(Order::getPrice).reversed()
        .thenComparingLong(Order::getCreatedAt);

    private final StagedTable<Account> accounts;
    private final StagedTable<Market> markets;
    private final StagedTable<Order> orders;
    private final StagedTable<Position> positions;
    private final StagedTable<Transaction> transactions;
    private final StagedTable<ExposureSnapshot> exposure;
    private final StagedTable<BotConfig> botConfig;
    private final StagedTable<MarketWeight> marketWeights;
    private final StagedTable<CurveShape> curveShapes;
    private final StagedTable<MarketOverride> overrides;
    private final StagedTable<BotActionLog> botActions;
    private final StagedTable<ResolutionLog> resolutionLogs;

    InMemoryLedgerSession(InMemoryLedgerStore store) {
        this.accounts = new StagedTable<>(store.accounts, Account::getId, Account::copy);
        this.markets = new StagedTable<>(store.markets, Market::getId, Market::copy);
        this.orders = new StagedTable<>(store.orders, Order::getId, Order::copy);
        this.positions = new StagedTable<>(store.positions, Position::getId, Position::copy);
        this.transactions = new StagedTable<>(store.transactions, Transaction::getId, Transaction::copy);
        this.exposure = new StagedTable<>(store.exposure, ExposureSnapshot::getId, ExposureSnapshot::copy);
        this.botConfig = new StagedTable<>(store.botConfig, BotConfig::getId, BotConfig::copy);
        this.marketWeights = new StagedTable<>(store.marketWeights, MarketWeight::getMarketId, MarketWeight::copy);
        this.curveShapes = new StagedTable<>(store.curveShapes, CurveShape::getId, CurveShape::copy);
        this.overrides = new StagedTable<>(store.overrides, MarketOverride::getMarketId, MarketOverride::copy);
        this.botActions = new StagedTable<>(store.botActions, BotActionLog::getId, BotActionLog::copy);
        this.resolutionLogs = new StagedTable<>(store.resolutionLogs, ResolutionLog::getId, ResolutionLog::copy);
    }

    void commit() {
        accounts.commit();
        markets.commit();
        orders.commit();
        positions.commit();
        transactions.commit();
        exposure.commit();
        botConfig.commit();
        marketWeights.commit();
        curveShapes.commit();
        overrides.commit();
        botActions.commit();
        resolutionLogs.commit();
    }

    @Override
    public Optional<Account> findAccount(String accountId) {
        return accounts.find(accountId);
    }

    @Override
    public List<Account> findAllAccounts() {
        return accounts.all();
    }

    @Override
    public void saveAccount(Account account) {
        accounts.save(account);
    }

    @Override
    public Optional<Market> findMarket(String marketId) {
        return markets.find(marketId);
    }

    @Override
    public List<Market> findMarketsByStatus(MarketStatus status) {
        return markets.filter(m -> m.getStatus() == status).stream()
            .sorted(Comparator.comparingLong(Market::getCreatedAt))
            .collect(Collectors.toList());
    }

    @Override
    public void saveMarket(Market market) {
        markets.save(market);
    }

    @Override
    public Optional<Order> findOrder(String orderId) {
        return orders.find(orderId);
    }

    @Override
    public List<Order> findActiveOrders(String marketId, Side side) {
        return orders.filter(o -> o.isActive() && o.getMarketId().equals(marketId) && o.getSide() == side).stream()
            .sorted(BOOK_ORDER)
            .collect(Collectors.toList());
    }

    @Override
    public List<Order> findActiveOrdersInMarket(String marketId) {
        return byCreation(orders.filter(o -> o.isActive() && o.getMarketId().equals(marketId)));
    }

    @Override
    public List<Order> findActiveOrdersByAccount(String accountId) {
        return byCreation(orders.filter(o -> o.isActive() && o.getAccountId().equals(accountId)));
    }

    @Override
    public List<Order> findAllActiveOrders() {
        return orders.filter(Order::isActive);
    }

    @Override
    public void saveOrder(Order order) {
        orders.save(order);
    }

    @Override
    public List<Position> findActivePositionsInMarket(String marketId) {
        return positionsByCreation(positions.filter(p -> p.isActive() && p.getMarketId().equals(marketId)));
    }

    @Override
    public List<Position> findActivePositionsForAccount(String accountId, String marketId) {
        return positionsByCreation(positions.filter(p -> p.isActive()
            && p.getMarketId().equals(marketId)
            && p.sideOf(accountId) != null));
    }

    @Override
    public List<Position> findActivePositionsByAccount(String accountId) {
        return positionsByCreation(positions.filter(p -> p.isActive() && p.sideOf(accountId) != null));
    }

    @Override
    public List<Position> findActiveShortPositions(String noAccountId) {
        return positions.filter(p -> p.isActive() && noAccountId.equals(p.getNoAccountId()));
    }

    @Override
    public List<Position> findAllActivePositions() {
        return positions.filter(Position::isActive);
    }

    @Override
    public List<Position> findRecentPositions(String marketId, int limit) {
        return positions.filter(p -> p.getMarketId().equals(marketId)).stream()
            .sorted(Comparator.comparingLong(Position::getCreatedAt).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public void savePosition(Position position) {
        positions.save(position);
    }

    @Override
    public void appendTransaction(Transaction transaction) {
        transactions.save(transaction);
    }

    @Override
    public List<Transaction> findTransactionsByAccount(String accountId) {
        return transactions.filter(t -> t.getAccountId().equals(accountId)).stream()
            .sorted(Comparator.comparingLong(Transaction::getTimestamp))
            .collect(Collectors.toList());
    }

    @Override
    public Optional<ExposureSnapshot> findExposure() {
        return exposure.find(ExposureSnapshot.SINGLETON_ID);
    }

    @Override
    public void saveExposure(ExposureSnapshot snapshot) {
        exposure.save(snapshot);
    }

    @Override
    public Optional<BotConfig> findBotConfig() {
        return botConfig.find(BotConfig.SINGLETON_ID);
    }

    @Override
    public void saveBotConfig(BotConfig config) {
        botConfig.save(config);
    }

    @Override
    public List<MarketWeight> findAllMarketWeights() {
        return marketWeights.all();
    }

    @Override
    public Optional<MarketWeight> findMarketWeight(String marketId) {
        return marketWeights.find(marketId);
    }

    @Override
    public void saveMarketWeight(MarketWeight weight) {
        marketWeights.save(weight);
    }

    @Override
    public Optional<CurveShape> findCurveShape(String shapeId) {
        return curveShapes.find(shapeId);
    }

    @Override
    public Optional<CurveShape> findDefaultCurveShape() {
        return curveShapes.filter(CurveShape::isDefaultShape).stream().findFirst();
    }

    @Override
    public List<CurveShape> findAllCurveShapes() {
        return curveShapes.all().stream()
            .sorted(Comparator.comparingLong(CurveShape::getCreatedAt))
            .collect(Collectors.toList());
    }

    @Override
    public void saveCurveShape(CurveShape shape) {
        curveShapes.save(shape);
    }

    @Override
    public void deleteCurveShape(String shapeId) {
        curveShapes.delete(shapeId);
    }

    @Override
    public Optional<MarketOverride> findMarketOverride(String marketId) {
        return overrides.find(marketId);
    }

    @Override
    public void saveMarketOverride(MarketOverride override) {
        overrides.save(override);
    }

    @Override
    public void deleteMarketOverride(String marketId) {
        overrides.delete(marketId);
    }

    @Override
    public void appendBotAction(BotActionLog entry) {
        botActions.save(entry);
    }

    @Override
    public List<BotActionLog> findRecentBotActions(int limit) {
        return botActions.all().stream()
            .sorted(Comparator.comparingLong(BotActionLog::getTimestamp).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    @Override
    public void appendResolutionLog(ResolutionLog entry) {
        resolutionLogs.save(entry);
    }

    @Override
    public Optional<ResolutionLog> findLatestResolutionLog(String marketId, ResolutionAction action) {
        return resolutionLogs.filter(r -> r.getMarketId().equals(marketId) && r.getAction() == action).stream()
            .max(Comparator.comparingLong(ResolutionLog::getTimestamp));
    }

    private static List<Order> byCreation(List<Order> rows) {
        return rows.stream().sorted(Comparator.comparingLong(Order::getCreatedAt)).collect(Collectors.toList());
    }

    private static List<Position> positionsByCreation(List<Position> rows) {
        return rows.stream().sorted(Comparator.comparingLong(Position::getCreatedAt)).collect(Collectors.toList());
    }
}
