package com.prediction.market.exchange.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

import org.springframework.stereotype.Service;

import com.prediction.market.exchange.bot.BotSettings;
import com.prediction.market.exchange.engine.CancelResult;
import com.prediction.market.exchange.engine.MatchingEngine;
import com.prediction.market.exchange.engine.OrderResult;
import com.prediction.market.exchange.engine.PlaceOrderCommand;
import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.entity.Transaction;
import com.prediction.market.exchange.entity.TransactionType;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.execution.MarketExecutionRegistry;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerPostings;
import com.prediction.market.exchange.ledger.LedgerStore;
import com.prediction.market.exchange.risk.PullbackController;
import com.prediction.market.exchange.risk.PullbackOutcome;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Order execution service - accounts, markets and the order lifecycle.
 *
 * Order Flow:
 * 1. Strict validation (OrderValidator)
 * 2. Hand off to the market's executor, so placements in one market are serialized
 * 3. One ledger transaction: match (MatchingEngine), then, if the bot took
 *    part, the exposure check and pullback pass (PullbackController)
 *
 * CRITICAL PROPERTIES:
 * - Atomic: a failed placement leaves no trace
 * - Validated: all orders pass strict validation
 * - Bounded: a fill that moves the bot's risk tier shrinks its book in the same transaction
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingService {

    private final LedgerStore ledgerStore;
    private final MatchingEngine matchingEngine;
    private final PullbackController pullbackController;
    private final BotSettings botSettings;
    private final OrderValidator orderValidator;
    private final MarketExecutionRegistry registry;
    private final LedgerClock clock;

    public Account openAccount(String accountId, long initialBalance) {
        if (accountId == null || accountId.isBlank()) {
            throw new InvalidArgumentException("accountId is required");
        }
        if (initialBalance < 0) {
            throw new InvalidArgumentException("initialBalance must not be negative");
        }
        return ledgerStore.inTransaction(session -> {
            if (session.findAccount(accountId).isPresent()) {
                throw new InvalidStateException("Account already exists: " + accountId);
            }
            long now = clock.tick();
            session.saveAccount(Account.builder().id(accountId).balance(0).createdAt(now).updatedAt(now).build());
            Account account = LedgerPostings.credit(session, accountId, initialBalance, TransactionType.DEPOSIT,
                null, accountId, now);
            log.info("Account opened: accountId={}, balance={}", accountId, initialBalance);
            return account;
        });
    }

    /**
     * Credit an existing account, the bot's included.
     */
    public Account deposit(String accountId, long amount) {
        if (amount <= 0) {
            throw new InvalidArgumentException("deposit amount must be positive");
        }
        return ledgerStore.inTransaction(session -> {
            LedgerPostings.requireAccount(session, accountId);
            Account account = LedgerPostings.credit(session, accountId, amount, TransactionType.DEPOSIT,
                null, accountId, clock.tick());
            log.info("Deposit: accountId={}, amount={}, balance={}", accountId, amount, account.getBalance());
            return account;
        });
    }

    public Market createMarket(String marketId, String title) {
        String id = marketId == null || marketId.isBlank() ? UUID.randomUUID().toString() : marketId;
        return ledgerStore.inTransaction(session -> {
            if (session.findMarket(id).isPresent()) {
                throw new InvalidStateException("Market already exists: " + id);
            }
            Market market = Market.builder().id(id).title(title).createdAt(clock.tick()).build();
            session.saveMarket(market);
            log.info("Market created: marketId={}, title={}", id, title);
            return market;
        });
    }

    /**
     * Place a limit order.
     *
     * @param accountId the owner
     * @param marketId the market
     * @param side YES or NO
     * @param price what the order pays per share, in [1, P-1]
     * @param shares number of shares
     * @return the order as it stands after matching, with fills, refund and auto-settlements
     */
    public OrderResult placeOrder(String accountId, String marketId, Side side, int price, int shares) {
        PlaceOrderCommand command = PlaceOrderCommand.builder()
            .accountId(accountId)
            .marketId(marketId)
            .side(side)
            .price(price)
            .shares(shares)
            .build();

        OrderValidator.ValidationResult validation = orderValidator.validate(command);
        if (!validation.isValid()) {
            throw new InvalidArgumentException(validation.getErrors());
        }

        return MarketRouting.onMarket(ledgerStore, registry, marketId, () -> ledgerStore.inTransaction(session -> {
            OrderResult result = matchingEngine.placeOrder(session, command);

            BotConfig config = botSettings.load(session);
            if (!result.getTouchedAccounts().contains(config.getBotAccountId()) || result.getPositions().isEmpty()) {
                return result;
            }
            Optional<PullbackOutcome> pullback = pullbackController.evaluate(session, config);
            // The pass may have shrunk this very order if it belongs to the bot.
            Order current = session.findOrder(result.getOrder().getId()).orElse(result.getOrder());
            return result.toBuilder().order(current).pullback(pullback.orElse(null)).build();
        }));
    }

    public CancelResult cancelOrder(String accountId, String orderId) {
        String marketId = ledgerStore.inTransaction(session -> session.findOrder(orderId)
            .map(Order::getMarketId)
            .orElseThrow(() -> new NotFoundException("Order", orderId)));
        return MarketRouting.onMarket(ledgerStore, registry, marketId,
            () -> ledgerStore.inTransaction(session -> matchingEngine.cancelOrder(session, accountId, orderId)));
    }

    public CancelResult cancelAllOrders(String accountId) {
        return ledgerStore.inTransaction(session -> matchingEngine.cancelAllOrders(session, accountId, null));
    }

    public Account getAccount(String accountId) {
        return ledgerStore.inTransaction(session -> LedgerPostings.requireAccount(session, accountId));
    }

    public Market getMarket(String marketId) {
        return ledgerStore.inTransaction(session -> session.findMarket(marketId)
            .orElseThrow(() -> new NotFoundException("Market", marketId)));
    }

    public Order getOrder(String orderId) {
        return ledgerStore.inTransaction(session -> session.findOrder(orderId)
            .orElseThrow(() -> new NotFoundException("Order", orderId)));
    }

    public OrderBookView getOrderBook(String marketId) {
        return ledgerStore.inTransaction(session -> {
            session.findMarket(marketId).orElseThrow(() -> new NotFoundException("Market", marketId));
            return OrderBookView.builder()
                .marketId(marketId)
                .yes(levels(session.findActiveOrders(marketId, Side.YES)))
                .no(levels(session.findActiveOrders(marketId, Side.NO)))
                .build();
        });
    }

    private static List<OrderBookView.Level> levels(List<Order> orders) {
        Map<Integer, long[]> byPrice = new TreeMap<>((a, b) -> Integer.compare(b, a));
        for (Order order : orders) {
            long[] level = byPrice.computeIfAbsent(order.getPrice(), p -> new long[2]);
            level[0] += order.getRemainingShares();
            level[1]++;
        }
        List<OrderBookView.Level> levels = new ArrayList<>(byPrice.size());
        byPrice.forEach((price, level) -> levels.add(OrderBookView.Level.builder()
            .price(price)
            .shares(level[0])
            .orders((int) level[1])
            .build()));
        return levels;
    }

    public List<Position> getRecentTrades(String marketId, int limit) {
        if (limit < 1) {
            throw new InvalidArgumentException("limit must be positive");
        }
        return ledgerStore.inTransaction(session -> session.findRecentPositions(marketId, limit));
    }

    public List<Order> getOpenOrders(String accountId) {
        return ledgerStore.inTransaction(session -> session.findActiveOrdersByAccount(accountId));
    }

    public List<Position> getActivePositions(String accountId) {
        return ledgerStore.inTransaction(session -> session.findActivePositionsByAccount(accountId));
    }

    public List<Transaction> getTransactions(String accountId) {
        return ledgerStore.inTransaction(session -> {
            LedgerPostings.requireAccount(session, accountId);
            return session.findTransactionsByAccount(accountId);
        });
    }
}
