package com.prediction.market.exchange.bot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.prediction.market.exchange.engine.CancelResult;
import com.prediction.market.exchange.engine.MatchingEngine;
import com.prediction.market.exchange.engine.OrderResult;
import com.prediction.market.exchange.engine.PlaceOrderCommand;
import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.BotAction;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.MarketStatus;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerPostings;
import com.prediction.market.exchange.ledger.LedgerSession;
import com.prediction.market.exchange.liquidity.LadderPoint;
import com.prediction.market.exchange.liquidity.LiquidityShaper;
import com.prediction.market.exchange.risk.PullbackController;
import com.prediction.market.exchange.risk.PullbackOutcome;

import lombok.extern.slf4j.Slf4j;

/**
 * Replaces the funding account's resting orders in a market with the
 * current target ladder.
 *
 * The old orders are cancelled and refunded first; new NO orders then go
 * through the matching engine in ladder order until the balance runs
 * out. Exposure is re-evaluated afterwards since the new orders may have
 * matched straight away.
 */
@Slf4j
public class DeploymentOrchestrator {

    private final MatchingEngine matchingEngine;
    private final LiquidityShaper shaper;
    private final PullbackController pullbackController;
    private final LedgerClock clock;

    public DeploymentOrchestrator(MatchingEngine matchingEngine, LiquidityShaper shaper,
            PullbackController pullbackController, LedgerClock clock) {
        this.matchingEngine = matchingEngine;
        this.shaper = shaper;
        this.pullbackController = pullbackController;
        this.clock = clock;
    }

    public DeploymentResult deployMarket(LedgerSession session, String marketId, String fundingAccountId,
            BotConfig config) {
        requireActive(config);
        LedgerPostings.requireAccount(session, fundingAccountId);
        Market market = session.findMarket(marketId)
            .orElseThrow(() -> new NotFoundException("Market", marketId));
        if (!market.isOpen()) {
            throw new InvalidStateException("Market " + marketId + " is not open: " + market.getStatus());
        }

        List<LadderPoint> ladder = shaper.computeEffectiveCurve(session, marketId, config);
        if (ladder == null) {
            throw new InvalidStateException("Market " + marketId + " is disabled for the bot");
        }
        return deploy(session, market, ladder, fundingAccountId, config);
    }

    public DeployAllResult deployAll(LedgerSession session, String fundingAccountId, BotConfig config) {
        requireActive(config);
        LedgerPostings.requireAccount(session, fundingAccountId);
        long before = pullbackController.getTracker().currentExposure(session, config.getBotAccountId());

        List<DeploymentResult> results = new ArrayList<>();
        int skipped = 0;
        for (Market market : session.findMarketsByStatus(MarketStatus.OPEN)) {
            List<LadderPoint> ladder = shaper.computeEffectiveCurve(session, market.getId(), config);
            if (ladder == null) {
                skipped++;
                continue;
            }
            results.add(deploy(session, market, ladder, fundingAccountId, config));
        }

        int orders = results.stream().mapToInt(r -> r.getOrders().size()).sum();
        long cost = results.stream().mapToLong(DeploymentResult::getTotalCost).sum();
        long refunded = results.stream().mapToLong(DeploymentResult::getRefunded).sum();
        long after = pullbackController.getTracker().currentExposure(session, config.getBotAccountId());

        BotActivity.record(session, BotAction.DEPLOY_ALL,
            String.format("fundingAccountId=%s, markets=%d, skipped=%d, orders=%d, cost=%d, refunded=%d",
                fundingAccountId, results.size(), skipped, orders, cost, refunded),
            before, after, clock.tick());
        log.info("Deployed all markets: fundingAccountId={}, markets={}, skipped={}, orders={}, cost={}",
            fundingAccountId, results.size(), skipped, orders, cost);

        return DeployAllResult.builder()
            .deployed(results.size())
            .skipped(skipped)
            .totalOrders(orders)
            .totalCost(cost)
            .totalRefunded(refunded)
            .markets(results)
            .build();
    }

    /**
     * Cancel every resting order of the account and refund it.
     */
    public CancelResult withdrawAll(LedgerSession session, String accountId, BotConfig config) {
        CancelResult result = matchingEngine.cancelAllOrders(session, accountId, null);
        long exposure = pullbackController.refresh(session, config).getTotalAtRisk();
        BotActivity.record(session, BotAction.WITHDRAW_ALL,
            String.format("accountId=%s, orders=%d, refund=%d", accountId, result.getOrders().size(),
                result.getRefunded()),
            exposure, exposure, clock.tick());
        return result;
    }

    /**
     * What {@link #deployAll} would place right now. Read-only.
     */
    public DeploymentPreview preview(LedgerSession session, String fundingAccountId, BotConfig config) {
        Account account = LedgerPostings.requireAccount(session, fundingAccountId);
        long existingRefund = session.findActiveOrdersByAccount(fundingAccountId).stream()
            .mapToLong(Order::getReservedAmount)
            .sum();
        long effectiveBalance = account.getBalance() + existingRefund;

        List<DeploymentPreview.MarketPreview> markets = new ArrayList<>();
        long totalCost = 0;
        int totalOrders = 0;
        int enabled = 0;
        for (Market market : session.findMarketsByStatus(MarketStatus.OPEN)) {
            List<LadderPoint> ladder = shaper.computeEffectiveCurve(session, market.getId(), config);
            if (ladder == null) {
                markets.add(DeploymentPreview.MarketPreview.builder()
                    .marketId(market.getId())
                    .disabled(true)
                    .orders(List.of())
                    .build());
                continue;
            }
            long cost = ladder.stream().mapToLong(LadderPoint::getCost).sum();
            long shares = ladder.stream().mapToLong(LadderPoint::getShares).sum();
            markets.add(DeploymentPreview.MarketPreview.builder()
                .marketId(market.getId())
                .orders(ladder)
                .totalShares(shares)
                .totalCost(cost)
                .build());
            totalCost += cost;
            totalOrders += ladder.size();
            enabled++;
        }

        boolean sufficient = effectiveBalance >= totalCost;
        return DeploymentPreview.builder()
            .fundingAccountId(fundingAccountId)
            .balance(account.getBalance())
            .existingOrdersRefund(existingRefund)
            .effectiveBalance(effectiveBalance)
            .totalCost(totalCost)
            .totalOrders(totalOrders)
            .totalMarkets(enabled)
            .sufficientBalance(sufficient)
            .shortfall(sufficient ? 0 : totalCost - effectiveBalance)
            .markets(markets)
            .build();
    }

    private DeploymentResult deploy(LedgerSession session, Market market, List<LadderPoint> ladder,
            String fundingAccountId, BotConfig config) {
        long before = pullbackController.getTracker().currentExposure(session, config.getBotAccountId());
        CancelResult replaced = matchingEngine.cancelAllOrders(session, fundingAccountId, market.getId());

        List<Order> placed = new ArrayList<>();
        long cost = 0;
        int skipped = 0;
        for (int i = 0; i < ladder.size(); i++) {
            LadderPoint point = ladder.get(i);
            Account account = LedgerPostings.requireAccount(session, fundingAccountId);
            if (!account.hasSufficientBalance(point.getCost())) {
                skipped = ladder.size() - i;
                break;
            }
            OrderResult result = matchingEngine.placeOrder(session, PlaceOrderCommand.builder()
                .accountId(fundingAccountId)
                .marketId(market.getId())
                .side(Side.NO)
                .price(point.getNoPrice())
                .shares(point.getShares())
                .build());
            placed.add(result.getOrder());
            cost += result.getReserved() - result.getRefunded();
        }

        Optional<PullbackOutcome> pullback = pullbackController.evaluate(session, config);
        if (pullback.isPresent()) {
            // report the orders as the pullback left them
            placed.replaceAll(order -> session.findOrder(order.getId()).orElse(order));
        }
        long after = pullbackController.getTracker().currentExposure(session, config.getBotAccountId());

        BotActivity.record(session, BotAction.DEPLOY_MARKET,
            String.format("marketId=%s, fundingAccountId=%s, orders=%d, cost=%d, refunded=%d, skipped=%d",
                market.getId(), fundingAccountId, placed.size(), cost, replaced.getRefunded(), skipped),
            before, after, clock.tick());
        log.info("Deployed market: marketId={}, fundingAccountId={}, orders={}, cost={}, refunded={}, skipped={}",
            market.getId(), fundingAccountId, placed.size(), cost, replaced.getRefunded(), skipped);

        return DeploymentResult.builder()
            .marketId(market.getId())
            .orders(placed)
            .totalCost(cost)
            .refunded(replaced.getRefunded())
            .pointsSkipped(skipped)
            .pullback(pullback.orElse(null))
            .build();
    }

    private static void requireActive(BotConfig config) {
        if (!config.isActive()) {
            throw new InvalidStateException("Bot is not active");
        }
    }
}
