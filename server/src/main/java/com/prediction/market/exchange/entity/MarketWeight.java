package com.prediction.market.exchange.entity;

import java.math.BigDecimal;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Fraction of the bot's liquidity budget assigned to one market.
 * Keyed by market id.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "market_weights")
public class MarketWeight {

    @MongoId
    private String marketId;

    private BigDecimal weight;

    /**
     * Locked weights are left alone by rebalancing.
     */
    private boolean locked;

    /**
     * Operator-supplied relative score, turned into weights by applyRelativeOdds.
     */
    @Builder.Default
    private BigDecimal relativeOdds = BigDecimal.ONE;

    private long updatedAt;

    public MarketWeight copy() {
        return toBuilder().build();
    }
}
