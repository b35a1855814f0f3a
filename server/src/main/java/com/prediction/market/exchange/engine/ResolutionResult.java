package com.prediction.market.exchange.engine;

import com.prediction.market.exchange.entity.MarketStatus;
import com.prediction.market.exchange.entity.Side;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ResolutionResult {
    String marketId;
    MarketStatus status;
    // Null when the market was cancelled instead of resolved.
    Side outcome;
    int positionsClosed;
    long paidOut;
    int ordersCancelled;
    long ordersRefunded;
}
