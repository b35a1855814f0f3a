package com.prediction.market.exchange.liquidity;

import java.util.List;

/**
 * The bot's ladder: YES probabilities in percent at which it offers liquidity.
 */
public final class PricePoints {

    public static final List<Integer> PERCENTS = List.of(5, 10, 15, 20, 25, 30, 35, 40, 45, 50);

    private PricePoints() {
    }

    /**
     * YES price in payout units for a probability in percent.
     */
    public static int yesPrice(int percent, int payoutUnit) {
        return percent * payoutUnit / 100;
    }
}
