package com.prediction.market.exchange.ledger;

import java.util.List;
import java.util.Optional;

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

/**
 * Reads and writes of one unit of work. Entities returned here belong to the
 * session: mutate them and hand them back to the matching {@code save} call.
 * "Active" orders are OPEN or PARTIAL; "active" positions are ACTIVE.
 */
public interface LedgerSession {

    // accounts
    Optional<Account> findAccount(String accountId);
    List<Account> findAllAccounts();
    void saveAccount(Account account);

    // markets
    Optional<Market> findMarket(String marketId);
    List<Market> findMarketsByStatus(MarketStatus status);
    void saveMarket(Market market);

    // orders
    Optional<Order> findOrder(String orderId);
    List<Order> findActiveOrders(String marketId, Side side);
    List<Order> findActiveOrdersInMarket(String marketId);
    List<Order> findActiveOrdersByAccount(String accountId);
    List<Order> findAllActiveOrders();
    void saveOrder(Order order);

    // positions
    List<Position> findActivePositionsInMarket(String marketId);
    List<Position> findActivePositionsForAccount(String accountId, String marketId);
    List<Position> findActivePositionsByAccount(String accountId);
    List<Position> findActiveShortPositions(String noAccountId);
    List<Position> findAllActivePositions();
    List<Position> findRecentPositions(String marketId, int limit);
    void savePosition(Position position);

    // transaction log
    void appendTransaction(Transaction transaction);
    List<Transaction> findTransactionsByAccount(String accountId);

    // bot risk state
    Optional<ExposureSnapshot> findExposure();
    void saveExposure(ExposureSnapshot snapshot);
    Optional<BotConfig> findBotConfig();
    void saveBotConfig(BotConfig config);

    // liquidity configuration
    List<MarketWeight> findAllMarketWeights();
    Optional<MarketWeight> findMarketWeight(String marketId);
    void saveMarketWeight(MarketWeight weight);

    Optional<CurveShape> findCurveShape(String shapeId);
    Optional<CurveShape> findDefaultCurveShape();
    List<CurveShape> findAllCurveShapes();
    void saveCurveShape(CurveShape shape);
    void deleteCurveShape(String shapeId);

    Optional<MarketOverride> findMarketOverride(String marketId);
    void saveMarketOverride(MarketOverride override);
    void deleteMarketOverride(String marketId);

    // audit logs
    void appendBotAction(BotActionLog entry);
    List<BotActionLog> findRecentBotActions(int limit);
    void appendResolutionLog(ResolutionLog entry);
    Optional<ResolutionLog> findLatestResolutionLog(String marketId, ResolutionAction action);
}
