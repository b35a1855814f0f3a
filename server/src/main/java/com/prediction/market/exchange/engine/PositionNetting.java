package com.prediction.market.exchange.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.TransactionType;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerPostings;
import com.prediction.market.exchange.ledger.LedgerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * Auto-settlement of hedged holdings.
 *
 * An account holding both YES and NO in one market owns {@code min(yes, no)}
 * riskless shares. Those are netted immediately: the oldest YES leg and the
 * oldest NO leg are settled with the account as winner and it is credited
 * {@code shares × P}. A leg netted only in part is split, the settled part
 * keeping the netted shares and an active remainder carrying the rest.
 *
 * The two outside counterparties of the netted legs still hold a claim
 * against each other, so they are bound into a fresh active position of the
 * same size. Balances plus locked position value stay constant.
 */
@Slf4j
public class PositionNetting {

    private final CostModel costModel;
    private final LedgerClock clock;

    public PositionNetting(CostModel costModel, LedgerClock clock) {
        this.costModel = costModel;
        this.clock = clock;
    }

    public Optional<AutoSettlement> settle(LedgerSession session, String accountId, String marketId) {
        int netted = 0;
        long credited = 0;
        List<String> settledIds = new ArrayList<>();
        List<Position> novated = new ArrayList<>();

        while (true) {
            List<Position> active = session.findActivePositionsForAccount(accountId, marketId);
            Position yesLeg = oldest(active, accountId, true);
            Position noLeg = oldest(active, accountId, false);
            if (yesLeg == null || noLeg == null) {
                break;
            }

            int shares = Math.min(yesLeg.getShares(), noLeg.getShares());
            long now = clock.tick();
            splitOff(session, yesLeg, shares);
            splitOff(session, noLeg, shares);

            yesLeg.settle(accountId, now);
            noLeg.settle(accountId, now);
            session.savePosition(yesLeg);
            session.savePosition(noLeg);

            long amount = costModel.payout(shares);
            LedgerPostings.credit(session, accountId, amount, TransactionType.POSITION_NETTED,
                marketId, yesLeg.getId() + "+" + noLeg.getId(), now);

            novate(session, yesLeg, noLeg, shares, now).ifPresent(novated::add);

            netted += shares;
            credited += amount;
            settledIds.add(yesLeg.getId());
            settledIds.add(noLeg.getId());
        }

        if (netted == 0) {
            return Optional.empty();
        }
        log.info("Auto-settled: accountId={}, marketId={}, shares={}, credited={}",
            accountId, marketId, netted, credited);
        return Optional.of(AutoSettlement.builder()
            .accountId(accountId)
            .marketId(marketId)
            .nettedShares(netted)
            .credited(credited)
            .settledPositionIds(settledIds)
            .novatedPositions(novated)
            .build());
    }

    private static Position oldest(List<Position> active, String accountId, boolean yesSide) {
        Position found = null;
        for (Position p : active) {
            String holder = yesSide ? p.getYesAccountId() : p.getNoAccountId();
            if (accountId.equals(holder) && (found == null || p.getCreatedAt() < found.getCreatedAt())) {
                found = p;
            }
        }
        return found;
    }

    /**
     * Cut {@code leg} down to {@code shares}, moving the rest into a new active position.
     */
    private static void splitOff(LedgerSession session, Position leg, int shares) {
        int rest = leg.getShares() - shares;
        if (rest == 0) {
            return;
        }
        Position remainder = leg.toBuilder()
            .id(UUID.randomUUID().toString())
            .shares(rest)
            .parentPositionId(leg.getId())
            .build();
        leg.setShares(shares);
        session.savePosition(remainder);
    }

    private Optional<Position> novate(LedgerSession session, Position yesLeg, Position noLeg, int shares, long now) {
        String longHolder = noLeg.getYesAccountId();
        String shortHolder = yesLeg.getNoAccountId();

        if (longHolder.equals(shortHolder)) {
            // Both outside legs belong to one account: its claim is riskless too.
            LedgerPostings.credit(session, longHolder, costModel.payout(shares), TransactionType.POSITION_NETTED,
                yesLeg.getMarketId(), yesLeg.getId() + "+" + noLeg.getId(), now);
            return Optional.empty();
        }

        Position bound = Position.builder()
            .id(UUID.randomUUID().toString())
            .marketId(yesLeg.getMarketId())
            .yesAccountId(longHolder)
            .noAccountId(shortHolder)
            .yesOrderId(noLeg.getYesOrderId())
            .noOrderId(yesLeg.getNoOrderId())
            .tradePrice(noLeg.getTradePrice())
            .shares(shares)
            .parentPositionId(noLeg.getId())
            .createdAt(now)
            .build();
        session.savePosition(bound);
        return Optional.of(bound);
    }
}
