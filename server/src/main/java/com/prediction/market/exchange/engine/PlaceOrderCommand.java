package com.prediction.market.exchange.engine;

import com.prediction.market.exchange.entity.Side;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PlaceOrderCommand {
    String accountId;
    String marketId;
    Side side;
    int price;
    int shares;
}
