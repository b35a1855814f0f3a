package com.prediction.market.exchange.risk;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * What one shrink pass over the bot's resting orders did.
 */
@Value
@Builder
public class PullbackOutcome {
    int previousTier;
    int newTier;
    long exposure;
    BigDecimal pullbackRatio;
    int ordersReduced;
    int ordersCancelled;
    long sharesReleased;
    long refunded;
}
