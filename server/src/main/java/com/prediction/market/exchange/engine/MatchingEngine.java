package com.prediction.market.exchange.engine;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.entity.TransactionType;
import com.prediction.market.exchange.error.ForbiddenException;
import com.prediction.market.exchange.error.InsufficientFundsException;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.InvariantViolationException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerPostings;
import com.prediction.market.exchange.ledger.LedgerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * Price-time priority continuous double auction.
 *
 * Order Flow:
 * 1. Reserve {@code shares × price} from the taker
 * 2. Walk crossing makers on the opposite side, best maker price first, oldest first
 * 3. Each slice trades at the maker's price; the taker pays the complement
 * 4. The unfilled residual rests in the book at the limit price
 * 5. Refund the price improvement
 * 6. Auto-settle every account the placement touched
 *
 * All mutations go through the given session, so the caller's transaction
 * decides whether they commit.
 */
@Slf4j
public class MatchingEngine {

    private final CostModel costModel;
    private final PositionNetting netting;
    private final LedgerClock clock;

    public MatchingEngine(CostModel costModel, PositionNetting netting, LedgerClock clock) {
        this.costModel = costModel;
        this.netting = netting;
        this.clock = clock;
    }

    public CostModel getCostModel() {
        return costModel;
    }

    public OrderResult placeOrder(LedgerSession session, PlaceOrderCommand command) {
        if (!costModel.isValidPrice(command.getPrice())) {
            throw new InvalidArgumentException(String.format("Price must be between %d and %d",
                costModel.getMinPrice(), costModel.getMaxPrice()));
        }
        if (command.getShares() <= 0) {
            throw new InvalidArgumentException("Shares must be a positive integer");
        }

        Account account = LedgerPostings.requireAccount(session, command.getAccountId());
        Market market = session.findMarket(command.getMarketId())
            .orElseThrow(() -> new NotFoundException("Market", command.getMarketId()));
        if (!market.isOpen()) {
            throw new InvalidStateException("Market " + market.getId() + " is not open: " + market.getStatus());
        }

        long reserved = costModel.reservation(command.getPrice(), command.getShares());
        if (!account.hasSufficientBalance(reserved)) {
            throw new InsufficientFundsException(account.getId(), reserved, account.getBalance());
        }

        long now = clock.tick();
        Order taker = Order.builder()
            .id(UUID.randomUUID().toString())
            .accountId(account.getId())
            .marketId(market.getId())
            .side(command.getSide())
            .price(command.getPrice())
            .shares(command.getShares())
            .createdAt(now)
            .updatedAt(now)
            .build();
        session.saveOrder(taker);
        LedgerPostings.debit(session, account, reserved, TransactionType.ORDER_RESERVED,
            market.getId(), taker.getId(), now);

        List<Position> positions = new ArrayList<>();
        Set<String> touched = new LinkedHashSet<>();
        touched.add(account.getId());
        long matchedCost = 0;

        for (Order maker : session.findActiveOrders(market.getId(), command.getSide().opposite())) {
            if (taker.getRemainingShares() == 0) {
                break;
            }
            if (!costModel.crosses(taker.getPrice(), maker.getPrice())) {
                // Makers arrive best price first: nothing further can cross.
                break;
            }
            if (maker.getAccountId().equals(taker.getAccountId())) {
                continue;
            }

            int quantity = Math.min(taker.getRemainingShares(), maker.getRemainingShares());
            long ts = clock.tick();
            maker.fill(quantity, ts);
            taker.fill(quantity, ts);
            session.saveOrder(maker);

            Position position = open(taker, maker, quantity, ts);
            session.savePosition(position);
            positions.add(position);
            touched.add(maker.getAccountId());
            matchedCost += (long) quantity * costModel.takerPricePerShare(maker.getPrice());

            log.debug("Matched: taker={}, maker={}, shares={}, makerPrice={}",
                taker.getId(), maker.getId(), quantity, maker.getPrice());
        }
        session.saveOrder(taker);

        long refund = (long) taker.getFilledShares() * taker.getPrice() - matchedCost;
        if (refund < 0) {
            throw new InvariantViolationException("negative price improvement on order " + taker.getId());
        }
        if (refund > 0) {
            LedgerPostings.credit(session, account.getId(), refund, TransactionType.PRICE_IMPROVEMENT,
                market.getId(), taker.getId(), clock.tick());
        }

        if (!positions.isEmpty()) {
            market.setLastTradeTimestamp(now);
            session.saveMarket(market);
        }

        List<AutoSettlement> settlements = new ArrayList<>();
        if (!positions.isEmpty()) {
            for (String accountId : touched) {
                netting.settle(session, accountId, market.getId()).ifPresent(settlements::add);
            }
        }

        long actualCost = matchedCost + costModel.reservation(taker.getPrice(), taker.getRemainingShares());
        log.info("Order placed: orderId={}, accountId={}, market={}, side={}, price={}, shares={}, filled={}, refund={}",
            taker.getId(), account.getId(), market.getId(), taker.getSide(), taker.getPrice(),
            taker.getShares(), taker.getFilledShares(), refund);

        return OrderResult.builder()
            .order(taker)
            .positions(positions)
            .reserved(reserved)
            .actualCost(actualCost)
            .refunded(refund)
            .autoSettlements(settlements)
            .touchedAccounts(touched)
            .build();
    }

    private Position open(Order taker, Order maker, int quantity, long ts) {
        Order yes = taker.getSide() == Side.YES ? taker : maker;
        Order no = taker.getSide() == Side.YES ? maker : taker;
        return Position.builder()
            .id(UUID.randomUUID().toString())
            .marketId(taker.getMarketId())
            .yesAccountId(yes.getAccountId())
            .noAccountId(no.getAccountId())
            .yesOrderId(yes.getId())
            .noOrderId(no.getId())
            .tradePrice(costModel.yesTradePrice(taker.getSide(), maker.getPrice()))
            .shares(quantity)
            .createdAt(ts)
            .build();
    }

    /**
     * Cancel one resting order and refund its unfilled reservation.
     */
    public CancelResult cancelOrder(LedgerSession session, String accountId, String orderId) {
        Order order = session.findOrder(orderId)
            .orElseThrow(() -> new NotFoundException("Order", orderId));
        if (!order.getAccountId().equals(accountId)) {
            throw new ForbiddenException("Cannot cancel order owned by different account");
        }
        if (!order.isActive()) {
            throw new InvalidStateException("Order is not active, cannot cancel: " + order.getStatus());
        }

        long refunded = release(session, order);
        log.info("Order cancelled: orderId={}, accountId={}, refunded={}", orderId, accountId, refunded);
        return CancelResult.builder().orders(List.of(order)).refunded(refunded).build();
    }

    /**
     * Cancel every resting order of an account, optionally limited to one market.
     */
    public CancelResult cancelAllOrders(LedgerSession session, String accountId, String marketId) {
        LedgerPostings.requireAccount(session, accountId);
        List<Order> cancelled = new ArrayList<>();
        long refunded = 0;
        for (Order order : session.findActiveOrdersByAccount(accountId)) {
            if (marketId != null && !marketId.equals(order.getMarketId())) {
                continue;
            }
            refunded += release(session, order);
            cancelled.add(order);
        }
        if (!cancelled.isEmpty()) {
            log.info("Orders cancelled: accountId={}, market={}, count={}, refunded={}",
                accountId, marketId == null ? "*" : marketId, cancelled.size(), refunded);
        }
        return CancelResult.builder().orders(cancelled).refunded(refunded).build();
    }

    long release(LedgerSession session, Order order) {
        long ts = clock.tick();
        long refunded = order.cancel(ts);
        session.saveOrder(order);
        if (refunded > 0) {
            LedgerPostings.credit(session, order.getAccountId(), refunded, TransactionType.ORDER_CANCELLED,
                order.getMarketId(), order.getId(), ts);
        }
        return refunded;
    }
}
