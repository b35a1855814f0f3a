package com.prediction.market.exchange.ledger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.springframework.data.domain.PageRequest;

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
import com.prediction.market.exchange.entity.PositionStatus;
import com.prediction.market.exchange.entity.ResolutionAction;
import com.prediction.market.exchange.entity.ResolutionLog;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.entity.Transaction;

/**
 * Session bound to the surrounding Mongo transaction. Writes go straight to
 * the transaction; an identity map makes repeated reads of one document
 * return the instance already in hand, so {@code @Version} checks only fire
 * against other transactions.
 */
class MongoLedgerSession implements LedgerSession {

    private final MongoLedgerRepositories repos;
    private final Map<Class<?>, Map<String, Object>> identity = new HashMap<>();

    MongoLedgerSession(MongoLedgerRepositories repos) {
        this.repos = repos;
    }

    private <E> E attach(Class<E> type, String id, E loaded) {
        Map<String, Object> rows = identity.computeIfAbsent(type, k -> new HashMap<>());
        Object known = rows.get(id);
        if (known != null) {
            return type.cast(known);
        }
        rows.put(id, loaded);
        return loaded;
    }

    private <E> Optional<E> attach(Class<E> type, Function<E, String> idOf, Optional<E> loaded) {
        return loaded.map(e -> attach(type, idOf.apply(e), e));
    }

    private <E> List<E> attachAll(Class<E> type, Function<E, String> idOf, List<E> loaded) {
        List<E> rows = new ArrayList<>(loaded.size());
        for (E e : loaded) {
            rows.add(attach(type, idOf.apply(e), e));
        }
        return rows;
    }

    private <E> void remember(Class<E> type, String id, E saved) {
        identity.computeIfAbsent(type, k -> new HashMap<>()).put(id, saved);
    }

    @Override
    public Optional<Account> findAccount(String accountId) {
        return attach(Account.class, Account::getId, repos.getAccounts().findById(accountId));
    }

    @Override
    public List<Account> findAllAccounts() {
        return attachAll(Account.class, Account::getId, repos.getAccounts().findAll());
    }

    @Override
    public void saveAccount(Account account) {
        remember(Account.class, account.getId(), repos.getAccounts().save(account));
    }

    @Override
    public Optional<Market> findMarket(String marketId) {
        return attach(Market.class, Market::getId, repos.getMarkets().findById(marketId));
    }

    @Override
    public List<Market> findMarketsByStatus(MarketStatus status) {
        return attachAll(Market.class, Market::getId, repos.getMarkets().findByStatusOrderByCreatedAtAsc(status));
    }

    @Override
    public void saveMarket(Market market) {
        remember(Market.class, market.getId(), repos.getMarkets().save(market));
    }

    @Override
    public Optional<Order> findOrder(String orderId) {
        return attach(Order.class, Order::getId, repos.getOrders().findById(orderId));
    }

    @Override
    public List<Order> findActiveOrders(String marketId, Side side) {
        return attachAll(Order.class, Order::getId, repos.getOrders().findActiveBookSide(marketId, side));
    }

    @Override
    public List<Order> findActiveOrdersInMarket(String marketId) {
        return attachAll(Order.class, Order::getId, repos.getOrders().findActiveOrdersByMarketId(marketId));
    }

    @Override
    public List<Order> findActiveOrdersByAccount(String accountId) {
        return attachAll(Order.class, Order::getId, repos.getOrders().findActiveOrdersByAccountId(accountId));
    }

    @Override
    public List<Order> findAllActiveOrders() {
        return attachAll(Order.class, Order::getId, repos.getOrders().findAllActive());
    }

    @Override
    public void saveOrder(Order order) {
        remember(Order.class, order.getId(), repos.getOrders().save(order));
    }

    @Override
    public List<Position> findActivePositionsInMarket(String marketId) {
        return attachAll(Position.class, Position::getId,
            repos.getPositions().findByMarketIdAndStatusOrderByCreatedAtAsc(marketId, PositionStatus.ACTIVE));
    }

    @Override
    public List<Position> findActivePositionsForAccount(String accountId, String marketId) {
        return attachAll(Position.class, Position::getId,
            repos.getPositions().findActiveForAccountInMarket(accountId, marketId));
    }

    @Override
    public List<Position> findActivePositionsByAccount(String accountId) {
        return attachAll(Position.class, Position::getId, repos.getPositions().findActiveForAccount(accountId));
    }

    @Override
    public List<Position> findActiveShortPositions(String noAccountId) {
        return attachAll(Position.class, Position::getId,
            repos.getPositions().findByNoAccountIdAndStatus(noAccountId, PositionStatus.ACTIVE));
    }

    @Override
    public List<Position> findAllActivePositions() {
        return attachAll(Position.class, Position::getId, repos.getPositions().findByStatus(PositionStatus.ACTIVE));
    }

    @Override
    public List<Position> findRecentPositions(String marketId, int limit) {
        return attachAll(Position.class, Position::getId,
            repos.getPositions().findByMarketIdOrderByCreatedAtDesc(marketId, PageRequest.of(0, limit)));
    }

    @Override
    public void savePosition(Position position) {
        remember(Position.class, position.getId(), repos.getPositions().save(position));
    }

    @Override
    public void appendTransaction(Transaction transaction) {
        repos.getTransactions().insert(transaction);
    }

    @Override
    public List<Transaction> findTransactionsByAccount(String accountId) {
        return repos.getTransactions().findByAccountIdOrderByTimestampAsc(accountId);
    }

    @Override
    public Optional<ExposureSnapshot> findExposure() {
        return attach(ExposureSnapshot.class, ExposureSnapshot::getId,
            repos.getExposure().findById(ExposureSnapshot.SINGLETON_ID));
    }

    @Override
    public void saveExposure(ExposureSnapshot snapshot) {
        remember(ExposureSnapshot.class, snapshot.getId(), repos.getExposure().save(snapshot));
    }

    @Override
    public Optional<BotConfig> findBotConfig() {
        return attach(BotConfig.class, BotConfig::getId, repos.getBotConfig().findById(BotConfig.SINGLETON_ID));
    }

    @Override
    public void saveBotConfig(BotConfig config) {
        remember(BotConfig.class, config.getId(), repos.getBotConfig().save(config));
    }

    @Override
    public List<MarketWeight> findAllMarketWeights() {
        return attachAll(MarketWeight.class, MarketWeight::getMarketId, repos.getMarketWeights().findAll());
    }

    @Override
    public Optional<MarketWeight> findMarketWeight(String marketId) {
        return attach(MarketWeight.class, MarketWeight::getMarketId, repos.getMarketWeights().findById(marketId));
    }

    @Override
    public void saveMarketWeight(MarketWeight weight) {
        remember(MarketWeight.class, weight.getMarketId(), repos.getMarketWeights().save(weight));
    }

    @Override
    public Optional<CurveShape> findCurveShape(String shapeId) {
        return attach(CurveShape.class, CurveShape::getId, repos.getCurveShapes().findById(shapeId));
    }

    @Override
    public Optional<CurveShape> findDefaultCurveShape() {
        return attach(CurveShape.class, CurveShape::getId, repos.getCurveShapes().findFirstByDefaultShapeTrue());
    }

    @Override
    public List<CurveShape> findAllCurveShapes() {
        return attachAll(CurveShape.class, CurveShape::getId, repos.getCurveShapes().findAllByOrderByCreatedAtAsc());
    }

    @Override
    public void saveCurveShape(CurveShape shape) {
        remember(CurveShape.class, shape.getId(), repos.getCurveShapes().save(shape));
    }

    @Override
    public void deleteCurveShape(String shapeId) {
        repos.getCurveShapes().deleteById(shapeId);
        forget(CurveShape.class, shapeId);
    }

    @Override
    public Optional<MarketOverride> findMarketOverride(String marketId) {
        return attach(MarketOverride.class, MarketOverride::getMarketId, repos.getOverrides().findById(marketId));
    }

    @Override
    public void saveMarketOverride(MarketOverride override) {
        remember(MarketOverride.class, override.getMarketId(), repos.getOverrides().save(override));
    }

    @Override
    public void deleteMarketOverride(String marketId) {
        repos.getOverrides().deleteById(marketId);
        forget(MarketOverride.class, marketId);
    }

    @Override
    public void appendBotAction(BotActionLog entry) {
        repos.getBotActions().insert(entry);
    }

    @Override
    public List<BotActionLog> findRecentBotActions(int limit) {
        return repos.getBotActions().findAllByOrderByTimestampDesc(PageRequest.of(0, limit));
    }

    @Override
    public void appendResolutionLog(ResolutionLog entry) {
        repos.getResolutionLogs().insert(entry);
    }

    @Override
    public Optional<ResolutionLog> findLatestResolutionLog(String marketId, ResolutionAction action) {
        return repos.getResolutionLogs().findFirstByMarketIdAndActionOrderByTimestampDesc(marketId, action);
    }

    private void forget(Class<?> type, String id) {
        Map<String, Object> rows = identity.get(type);
        if (rows != null) {
            rows.remove(id);
        }
    }
}
