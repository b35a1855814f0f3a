package com.prediction.market.exchange.engine;

import java.util.ArrayList;
import java.util.List;

import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.MarketStatus;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.entity.TransactionType;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerPostings;
import com.prediction.market.exchange.ledger.LedgerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * Terminal market transitions: resolution pays winners, cancellation
 * returns everyone's stake. Both cancel the remaining book with refunds
 * and reject a market that is already terminal, so nothing pays twice.
 */
@Slf4j
public class MarketSettlement {

    private final CostModel costModel;
    private final MatchingEngine matchingEngine;
    private final LedgerClock clock;

    public MarketSettlement(CostModel costModel, MatchingEngine matchingEngine, LedgerClock clock) {
        this.costModel = costModel;
        this.matchingEngine = matchingEngine;
        this.clock = clock;
    }

    public ResolutionResult resolve(LedgerSession session, String marketId, Side outcome) {
        Market market = requireLive(session, marketId);

        int closed = 0;
        long paid = 0;
        for (Position position : session.findActivePositionsInMarket(marketId)) {
            long ts = clock.tick();
            String winner = position.holderOf(outcome);
            String loser = position.holderOf(outcome.opposite());
            long payout = costModel.payout(position.getShares());

            LedgerPostings.credit(session, winner, payout, TransactionType.POSITION_WON, marketId, position.getId(), ts);
            LedgerPostings.credit(session, loser, 0, TransactionType.POSITION_LOST, marketId, position.getId(), ts);
            position.settle(winner, ts);
            session.savePosition(position);

            closed++;
            paid += payout;
        }

        CancelResult book = cancelBook(session, marketId);

        long now = clock.tick();
        market.setStatus(MarketStatus.RESOLVED);
        market.setResolution(outcome);
        market.setResolvedAt(now);
        session.saveMarket(market);

        log.info("Market resolved: marketId={}, outcome={}, positions={}, paid={}, ordersCancelled={}, refunded={}",
            marketId, outcome, closed, paid, book.getOrders().size(), book.getRefunded());
        return ResolutionResult.builder()
            .marketId(marketId)
            .status(MarketStatus.RESOLVED)
            .outcome(outcome)
            .positionsClosed(closed)
            .paidOut(paid)
            .ordersCancelled(book.getOrders().size())
            .ordersRefunded(book.getRefunded())
            .build();
    }

    /**
     * Void the market: resting orders are cancelled and each side of every
     * active position gets back exactly what it paid.
     */
    public ResolutionResult cancelMarket(LedgerSession session, String marketId) {
        Market market = requireLive(session, marketId);

        int closed = 0;
        long returned = 0;
        for (Position position : session.findActivePositionsInMarket(marketId)) {
            long ts = clock.tick();
            for (Side side : Side.values()) {
                long amount = costModel.paidIn(position, side);
                LedgerPostings.credit(session, position.holderOf(side), amount, TransactionType.POSITION_REFUNDED,
                    marketId, position.getId(), ts);
                returned += amount;
            }
            position.markRefunded(ts);
            session.savePosition(position);
            closed++;
        }

        CancelResult book = cancelBook(session, marketId);

        long now = clock.tick();
        market.setStatus(MarketStatus.CANCELLED);
        market.setResolvedAt(now);
        session.saveMarket(market);

        log.info("Market cancelled: marketId={}, positionsRefunded={}, returned={}, ordersCancelled={}",
            marketId, closed, returned, book.getOrders().size());
        return ResolutionResult.builder()
            .marketId(marketId)
            .status(MarketStatus.CANCELLED)
            .positionsClosed(closed)
            .paidOut(returned)
            .ordersCancelled(book.getOrders().size())
            .ordersRefunded(book.getRefunded())
            .build();
    }

    private Market requireLive(LedgerSession session, String marketId) {
        Market market = session.findMarket(marketId)
            .orElseThrow(() -> new NotFoundException("Market", marketId));
        if (market.getStatus().isTerminal()) {
            throw new InvalidStateException("Market " + marketId + " is already " + market.getStatus());
        }
        return market;
    }

    private CancelResult cancelBook(LedgerSession session, String marketId) {
        List<Order> cancelled = new ArrayList<>();
        long refunded = 0;
        for (Order order : session.findActiveOrdersInMarket(marketId)) {
            refunded += matchingEngine.release(session, order);
            cancelled.add(order);
        }
        return CancelResult.builder().orders(cancelled).refunded(refunded).build();
    }
}
