package com.prediction.market.exchange.liquidity;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.MarketStatus;
import com.prediction.market.exchange.entity.MarketWeight;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * Splits the bot's liquidity budget across open markets.
 *
 * Weights are fixed-point decimals. Every change ends with a normalization
 * pass: locked weights stay as set, unlocked weights are scaled to fill
 * {@code 1 - lockedSum}, and the rounding residue goes to the largest
 * unlocked weight so the unlocked and locked weights add up to exactly 1
 * whenever the locked ones leave room.
 */
@Slf4j
public class MarketWeightBalancer {

    public static final int SCALE = 12;
    private static final RoundingMode ROUNDING = RoundingMode.HALF_EVEN;

    private final LedgerClock clock;

    public MarketWeightBalancer(LedgerClock clock) {
        this.clock = clock;
    }

    /**
     * Give every open market without a weight an equal share, then normalize.
     */
    public List<MarketWeight> initialize(LedgerSession session) {
        List<Market> open = session.findMarketsByStatus(MarketStatus.OPEN);
        if (open.isEmpty()) {
            return List.of();
        }
        BigDecimal share = BigDecimal.ONE.divide(BigDecimal.valueOf(open.size()), SCALE, ROUNDING);
        long now = clock.tick();
        for (Market market : open) {
            if (session.findMarketWeight(market.getId()).isEmpty()) {
                session.saveMarketWeight(MarketWeight.builder()
                    .marketId(market.getId())
                    .weight(share)
                    .updatedAt(now)
                    .build());
            }
        }
        normalize(session, Set.of());
        return list(session);
    }

    /**
     * Weights of open markets, largest first.
     */
    public List<MarketWeight> list(LedgerSession session) {
        return openWeights(session).stream()
            .sorted(Comparator.comparing(MarketWeight::getWeight).reversed())
            .collect(Collectors.toList());
    }

    public BigDecimal weightOf(LedgerSession session, String marketId) {
        return session.findMarketWeight(marketId).map(MarketWeight::getWeight).orElse(BigDecimal.ZERO);
    }

    /**
     * Set one market's weight, clamped to [0, 1].
     *
     * Locked: the other unlocked markets share what is left. Unlocked: the
     * change is spread over the other unlocked markets in proportion to their
     * weights (equally if they are all zero), then everything is normalized.
     */
    public void setWeight(LedgerSession session, String marketId, BigDecimal weight, boolean lock) {
        if (weight == null) {
            throw new InvalidArgumentException("weight is required");
        }
        requireOpen(session, marketId);
        BigDecimal clamped = weight.max(BigDecimal.ZERO).min(BigDecimal.ONE).setScale(SCALE, ROUNDING);
        long now = clock.tick();

        MarketWeight row = session.findMarketWeight(marketId).orElse(null);
        if (row == null) {
            session.saveMarketWeight(MarketWeight.builder()
                .marketId(marketId)
                .weight(clamped)
                .locked(lock)
                .updatedAt(now)
                .build());
            normalize(session, Set.of(marketId));
            return;
        }

        BigDecimal diff = clamped.subtract(row.getWeight());
        row.setWeight(clamped);
        row.setLocked(lock);
        row.setUpdatedAt(now);
        session.saveMarketWeight(row);

        if (lock) {
            normalize(session, Set.of(marketId));
        } else {
            spread(session, marketId, diff, now);
            normalize(session, Set.of());
        }
        log.info("Market weight set: marketId={}, weight={}, locked={}", marketId, clamped, lock);
    }

    public void setLock(LedgerSession session, String marketId, boolean locked) {
        MarketWeight row = session.findMarketWeight(marketId)
            .orElseThrow(() -> new NotFoundException("Market weight", marketId));
        row.setLocked(locked);
        row.setUpdatedAt(clock.tick());
        session.saveMarketWeight(row);
        if (!locked) {
            normalize(session, Set.of());
        }
    }

    public void setRelativeOdds(LedgerSession session, String marketId, BigDecimal odds) {
        if (odds == null || odds.signum() < 0) {
            throw new InvalidArgumentException("relative odds must be non-negative");
        }
        MarketWeight row = session.findMarketWeight(marketId)
            .orElseThrow(() -> new NotFoundException("Market weight", marketId));
        row.setRelativeOdds(odds);
        row.setUpdatedAt(clock.tick());
        session.saveMarketWeight(row);
    }

    /**
     * Derive unlocked weights from relative odds: {@code odds / totalOdds}, then normalize.
     */
    public void applyRelativeOdds(LedgerSession session) {
        List<MarketWeight> unlocked = openWeights(session).stream()
            .filter(w -> !w.isLocked())
            .collect(Collectors.toList());
        BigDecimal totalOdds = unlocked.stream()
            .map(MarketWeight::getRelativeOdds)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        long now = clock.tick();
        for (MarketWeight row : unlocked) {
            BigDecimal weight = totalOdds.signum() > 0
                ? row.getRelativeOdds().divide(totalOdds, SCALE, ROUNDING)
                : BigDecimal.ZERO.setScale(SCALE);
            row.setWeight(weight);
            row.setUpdatedAt(now);
            session.saveMarketWeight(row);
        }
        normalize(session, Set.of());
    }

    private void spread(LedgerSession session, String marketId, BigDecimal diff, long now) {
        if (diff.signum() == 0) {
            return;
        }
        List<MarketWeight> others = openWeights(session).stream()
            .filter(w -> !w.getMarketId().equals(marketId) && !w.isLocked())
            .collect(Collectors.toList());
        if (others.isEmpty()) {
            return;
        }
        BigDecimal total = others.stream().map(MarketWeight::getWeight).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal count = BigDecimal.valueOf(others.size());
        for (MarketWeight row : others) {
            BigDecimal proportion = total.signum() > 0
                ? row.getWeight().divide(total, SCALE, ROUNDING)
                : BigDecimal.ONE.divide(count, SCALE, ROUNDING);
            BigDecimal adjusted = row.getWeight().subtract(diff.multiply(proportion)).max(BigDecimal.ZERO);
            row.setWeight(adjusted.setScale(SCALE, ROUNDING));
            row.setUpdatedAt(now);
            session.saveMarketWeight(row);
        }
    }

    /**
     * @param alsoLocked market ids treated as locked for this pass only
     */
    void normalize(LedgerSession session, Set<String> alsoLocked) {
        List<MarketWeight> locked = new ArrayList<>();
        List<MarketWeight> unlocked = new ArrayList<>();
        for (MarketWeight row : openWeights(session)) {
            if (row.isLocked() || alsoLocked.contains(row.getMarketId())) {
                locked.add(row);
            } else {
                unlocked.add(row);
            }
        }
        if (unlocked.isEmpty()) {
            return;
        }

        BigDecimal lockedSum = locked.stream().map(MarketWeight::getWeight).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal remaining = BigDecimal.ONE.subtract(lockedSum).max(BigDecimal.ZERO);
        BigDecimal unlockedSum = unlocked.stream().map(MarketWeight::getWeight).reduce(BigDecimal.ZERO, BigDecimal::add);

        BigDecimal assigned = BigDecimal.ZERO;
        MarketWeight largest = null;
        for (MarketWeight row : unlocked) {
            BigDecimal weight = unlockedSum.signum() > 0
                ? row.getWeight().multiply(remaining).divide(unlockedSum, SCALE, ROUNDING)
                : remaining.divide(BigDecimal.valueOf(unlocked.size()), SCALE, ROUNDING);
            row.setWeight(weight);
            assigned = assigned.add(weight);
            if (largest == null || weight.compareTo(largest.getWeight()) > 0) {
                largest = row;
            }
        }
        BigDecimal residue = remaining.subtract(assigned);
        if (residue.signum() != 0) {
            largest.setWeight(largest.getWeight().add(residue).max(BigDecimal.ZERO).setScale(SCALE, ROUNDING));
        }

        long now = clock.tick();
        for (MarketWeight row : unlocked) {
            row.setUpdatedAt(now);
            session.saveMarketWeight(row);
        }
    }

    private List<MarketWeight> openWeights(LedgerSession session) {
        List<MarketWeight> rows = new ArrayList<>();
        for (MarketWeight row : session.findAllMarketWeights()) {
            boolean open = session.findMarket(row.getMarketId()).map(Market::isOpen).orElse(false);
            if (open) {
                rows.add(row);
            }
        }
        return rows;
    }

    private void requireOpen(LedgerSession session, String marketId) {
        Market market = session.findMarket(marketId)
            .orElseThrow(() -> new NotFoundException("Market", marketId));
        if (!market.isOpen()) {
            throw new InvalidStateException("Market " + marketId + " is not open: " + market.getStatus());
        }
    }
}
