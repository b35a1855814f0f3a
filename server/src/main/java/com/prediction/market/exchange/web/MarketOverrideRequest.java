package com.prediction.market.exchange.web;

import java.math.BigDecimal;
import java.util.List;

import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.liquidity.OverrideRule;

import jakarta.validation.constraints.NotNull;
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
public class MarketOverrideRequest {

    @NotNull
    private OverrideRule.Kind kind;

    private BigDecimal multiplier;

    private List<CurvePoint> curve;

    public OverrideRule toRule() {
        return switch (kind) {
            case DEFAULT -> OverrideRule.defaultRule();
            case DISABLED -> OverrideRule.disabled();
            case MULTIPLIED -> OverrideRule.multiplied(multiplier);
            case REPLACED -> OverrideRule.replaced(curve);
        };
    }
}
