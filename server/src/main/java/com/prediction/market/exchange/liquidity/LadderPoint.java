package com.prediction.market.exchange.liquidity;

import lombok.Builder;
import lombok.Value;

/**
 * One rung of the bot's target ladder. The bot offers {@code shares} NO
 * shares at {@code noPrice}, which a YES buyer takes at {@code price}.
 */
@Value
@Builder
public class LadderPoint {
    int percent;
    // YES price in payout units.
    int price;
    int noPrice;
    long amount;
    int shares;

    public long getCost() {
        return (long) noPrice * shares;
    }
}
