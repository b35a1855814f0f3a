package com.prediction.market.exchange.service;

import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Resting liquidity of one market, aggregated per side and price, best price first.
 */
@Value
@Builder
public class OrderBookView {
    String marketId;
    List<Level> yes;
    List<Level> no;

    @Value
    @Builder
    public static class Level {
        int price;
        long shares;
        int orders;
    }
}
