package com.prediction.market.exchange.web;

import java.util.List;
import java.util.Map;

import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.entity.ShapeType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CurveShapeRequest {

    private String name;

    private ShapeType type;

    private Map<String, Double> params;

    /**
     * Only read for CUSTOM shapes.
     */
    private List<CurvePoint> points;
}
