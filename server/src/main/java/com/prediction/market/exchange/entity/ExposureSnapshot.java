package com.prediction.market.exchange.entity;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Last evaluated worst-case payout of the liquidity bot and its risk tier.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "exposure")
public class ExposureSnapshot {

    public static final String SINGLETON_ID = "bot";

    @MongoId
    private String id;

    private long totalAtRisk;

    private int tier;

    private Long lastPullbackAt;

    private long updatedAt;

    @Version
    private Long version;

    public static ExposureSnapshot empty() {
        return ExposureSnapshot.builder().id(SINGLETON_ID).build();
    }

    public ExposureSnapshot copy() {
        return toBuilder().build();
    }
}
