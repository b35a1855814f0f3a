package com.prediction.market.exchange.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Matched position ("bet"): {@code shares} YES shares held by
 * {@code yesAccountId} against the same number of NO shares held by
 * {@code noAccountId}. Whoever wins receives {@code shares × P}.
 *
 * {@code tradePrice} is what the YES side paid per share; the NO side paid
 * {@code P - tradePrice}.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "positions")
@CompoundIndex(name = "market_status_idx", def = "{'marketId':1,'status':1,'createdAt':1}")
@CompoundIndex(name = "no_account_status_idx", def = "{'noAccountId':1,'status':1}")
public class Position {

    @MongoId
    private String id;

    @Indexed
    private String marketId;

    private String yesAccountId;
    private String noAccountId;

    private String yesOrderId;
    private String noOrderId;

    private int tradePrice;

    private int shares;

    @Builder.Default
    private PositionStatus status = PositionStatus.ACTIVE;

    private String winnerAccountId;

    /**
     * Position this one was split from or novated out of, if any.
     */
    private String parentPositionId;

    private long createdAt;
    private Long settledAt;

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    public Side sideOf(String accountId) {
        if (accountId.equals(yesAccountId)) {
            return Side.YES;
        }
        if (accountId.equals(noAccountId)) {
            return Side.NO;
        }
        return null;
    }

    public String holderOf(Side side) {
        return side == Side.YES ? yesAccountId : noAccountId;
    }

    public long payout(int payoutUnit) {
        return (long) shares * payoutUnit;
    }

    public void settle(String winner, long timestamp) {
        this.status = PositionStatus.SETTLED;
        this.winnerAccountId = winner;
        this.settledAt = timestamp;
    }

    public void markRefunded(long timestamp) {
        this.status = PositionStatus.REFUNDED;
        this.settledAt = timestamp;
    }

    public Position copy() {
        return toBuilder().build();
    }
}
