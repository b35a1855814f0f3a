package com.prediction.market.exchange.engine;

import java.util.List;
import java.util.Set;

import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.risk.PullbackOutcome;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class OrderResult {
    Order order;
    List<Position> positions;
    long reserved;
    long actualCost;
    long refunded;
    List<AutoSettlement> autoSettlements;
    // Taker and every maker whose order was filled.
    Set<String> touchedAccounts;
    // Present when the placement moved the bot into another risk tier.
    PullbackOutcome pullback;

    public int getFilledShares() {
        return order.getFilledShares();
    }
}
