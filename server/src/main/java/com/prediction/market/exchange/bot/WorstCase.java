package com.prediction.market.exchange.bot;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

/**
 * The bot can never lose more than {@code maxLoss}: offers scale down
 * linearly and vanish once exposure reaches it.
 */
@Value
@Builder
public class WorstCase {
    long currentExposure;
    long maxLoss;
    long worstCase;
    BigDecimal exposurePercent;
    long remaining;
}
