package com.prediction.market.exchange.entity;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Persisted form of a per-market override. Absence of a document means the
 * market follows the default curve.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "market_overrides")
public class MarketOverride {

    @MongoId
    private String marketId;

    private OverrideType type;

    private BigDecimal multiplier;

    /**
     * Normalized replacement curve, for REPLACED only.
     */
    private List<CurvePoint> customCurve;

    private long updatedAt;

    public MarketOverride copy() {
        return toBuilder()
            .customCurve(customCurve == null ? null : customCurve.stream()
                .map(point -> new CurvePoint(point.getPrice(), point.getWeight()))
                .collect(Collectors.toCollection(ArrayList::new)))
            .build();
    }
}
