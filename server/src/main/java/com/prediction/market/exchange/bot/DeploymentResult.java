package com.prediction.market.exchange.bot;

import java.util.List;

import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.risk.PullbackOutcome;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeploymentResult {
    String marketId;
    List<Order> orders;
    // Reserved for the new orders, net of price improvement.
    long totalCost;
    // Returned from the orders the deployment replaced.
    long refunded;
    // Ladder points left out because the funding balance ran out.
    int pointsSkipped;
    PullbackOutcome pullback;
}
