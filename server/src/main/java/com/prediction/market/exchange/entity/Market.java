package com.prediction.market.exchange.entity;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "markets")
public class Market {

    @MongoId
    private String id;

    private String title;

    @Indexed
    @Builder.Default
    private MarketStatus status = MarketStatus.OPEN;

    /**
     * Set once, when the market resolves.
     */
    private Side resolution;

    private long createdAt;
    private Long resolvedAt;
    private long lastTradeTimestamp;

    @Version
    private Long version;

    public boolean isOpen() {
        return status == MarketStatus.OPEN;
    }

    public Market copy() {
        return toBuilder().build();
    }
}
