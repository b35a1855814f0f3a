package com.prediction.market.exchange.bot;

import java.util.List;

import com.prediction.market.exchange.liquidity.LadderPoint;

import lombok.Builder;
import lombok.Value;

/**
 * What {@code deployAll} would do for a funding account, computed without placing anything.
 */
@Value
@Builder
public class DeploymentPreview {
    String fundingAccountId;
    long balance;
    long existingOrdersRefund;
    long effectiveBalance;
    long totalCost;
    int totalOrders;
    int totalMarkets;
    boolean sufficientBalance;
    long shortfall;
    List<MarketPreview> markets;

    @Value
    @Builder
    public static class MarketPreview {
        String marketId;
        boolean disabled;
        List<LadderPoint> orders;
        long totalShares;
        long totalCost;
    }
}
