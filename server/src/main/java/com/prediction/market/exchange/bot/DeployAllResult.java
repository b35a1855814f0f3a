package com.prediction.market.exchange.bot;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeployAllResult {
    int deployed;
    int skipped;
    int totalOrders;
    long totalCost;
    long totalRefunded;
    List<DeploymentResult> markets;
}
