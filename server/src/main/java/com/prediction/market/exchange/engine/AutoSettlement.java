package com.prediction.market.exchange.engine;

import java.util.List;

import com.prediction.market.exchange.entity.Position;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of netting one account's opposing YES and NO positions in a market.
 */
@Value
@Builder
public class AutoSettlement {
    String accountId;
    String marketId;
    int nettedShares;
    long credited;
    List<String> settledPositionIds;
    // Positions binding the outside counterparties of the netted legs together.
    List<Position> novatedPositions;
}
