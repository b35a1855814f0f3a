package com.prediction.market.exchange.liquidity;

import java.math.BigDecimal;
import java.util.List;

import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.entity.MarketOverride;
import com.prediction.market.exchange.error.InvalidArgumentException;

/**
 * How the bot treats one market: default sizing, not at all, a replaced
 * curve, or default sizing scaled by a factor.
 */
public final class OverrideRule {

    public enum Kind {
        DEFAULT,
        DISABLED,
        REPLACED,
        MULTIPLIED
    }

    private static final OverrideRule DEFAULT = new OverrideRule(Kind.DEFAULT, BigDecimal.ONE, null);
    private static final OverrideRule DISABLED = new OverrideRule(Kind.DISABLED, BigDecimal.ZERO, null);

    private final Kind kind;
    private final BigDecimal multiplier;
    private final List<CurvePoint> curve;

    private OverrideRule(Kind kind, BigDecimal multiplier, List<CurvePoint> curve) {
        this.kind = kind;
        this.multiplier = multiplier;
        this.curve = curve;
    }

    public static OverrideRule defaultRule() {
        return DEFAULT;
    }

    public static OverrideRule disabled() {
        return DISABLED;
    }

    /**
     * @param curve points in YES percent; normalized here
     */
    public static OverrideRule replaced(List<CurvePoint> curve) {
        ShapeParams.Custom validated = new ShapeParams.Custom(curve);
        return new OverrideRule(Kind.REPLACED, BigDecimal.ONE, ShapeGenerator.generate(validated));
    }

    public static OverrideRule multiplied(BigDecimal factor) {
        if (factor == null || factor.signum() < 0) {
            throw new InvalidArgumentException("multiplier must be non-negative");
        }
        return new OverrideRule(Kind.MULTIPLIED, factor, null);
    }

    public static OverrideRule from(MarketOverride override) {
        if (override == null || override.getType() == null) {
            return DEFAULT;
        }
        return switch (override.getType()) {
            case DISABLED -> DISABLED;
            case REPLACED -> new OverrideRule(Kind.REPLACED, BigDecimal.ONE,
                ShapeGenerator.normalize(override.getCustomCurve()));
            case MULTIPLIED -> new OverrideRule(Kind.MULTIPLIED, override.getMultiplier(), null);
        };
    }

    public Kind getKind() {
        return kind;
    }

    public BigDecimal getMultiplier() {
        return multiplier;
    }

    public List<CurvePoint> getCurve() {
        return curve;
    }

    public boolean isDisabled() {
        return kind == Kind.DISABLED;
    }
}
