package com.prediction.market.exchange.entity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

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
 * Saved curve shape from the shape library. {@code points} always sum to 1.0.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "curve_shapes")
public class CurveShape {

    @MongoId
    private String id;

    private String name;

    private ShapeType type;

    @Builder.Default
    private Map<String, Double> params = new LinkedHashMap<>();

    @Builder.Default
    private List<CurvePoint> points = new ArrayList<>();

    @Indexed
    private boolean defaultShape;

    private long createdAt;
    private long updatedAt;

    public CurveShape copy() {
        List<CurvePoint> pointsCopy = new ArrayList<>();
        for (CurvePoint point : points) {
            pointsCopy.add(new CurvePoint(point.getPrice(), point.getWeight()));
        }
        return toBuilder()
            .params(new LinkedHashMap<>(params))
            .points(pointsCopy)
            .build();
    }
}
