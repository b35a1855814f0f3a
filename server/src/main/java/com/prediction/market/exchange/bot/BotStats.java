package com.prediction.market.exchange.bot;

import java.math.BigDecimal;
import java.util.Map;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BotStats {
    String botAccountId;
    boolean active;
    long exposure;
    long maxLoss;
    int tier;
    // Exposure at which the next tier starts.
    long nextThreshold;
    BigDecimal pullbackRatio;
    Long lastPullbackAt;
    int restingOrders;
    long offeredShares;
    long lockedReservation;
    long availableBalance;
    Map<String, Long> exposureByMarket;
}
