package com.prediction.market.exchange.liquidity;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.entity.ShapeType;
import com.prediction.market.exchange.error.InvalidArgumentException;

/**
 * Typed parameters of one curve shape kind. Each kind computes its own raw,
 * unnormalized weight per price point.
 */
public abstract class ShapeParams {

    public abstract ShapeType getType();

    /**
     * Unnormalized weight at a YES probability in percent.
     */
    abstract double rawWeight(int percent);

    public abstract Map<String, Double> toMap();

    /**
     * Price points this shape is defined on.
     */
    List<Integer> percents() {
        return PricePoints.PERCENTS;
    }

    /**
     * Build typed parameters from a loosely typed map, filling defaults for
     * missing keys. {@code CUSTOM} reads {@code points} instead.
     */
    public static ShapeParams of(ShapeType type, Map<String, Double> params, List<CurvePoint> points) {
        Map<String, Double> p = params == null ? Map.of() : params;
        return switch (type) {
            case BELL -> new Bell(p.getOrDefault("mu", 20.0), p.getOrDefault("sigma", 15.0));
            case FLAT -> new Flat();
            case EXPONENTIAL -> new Exponential(p.getOrDefault("decay", 0.08));
            case LOGARITHMIC -> new Logarithmic();
            case SIGMOID -> new Sigmoid(p.getOrDefault("midpoint", 25.0), p.getOrDefault("steepness", 0.3));
            case PARABOLIC -> new Parabolic(p.getOrDefault("maxPrice", 55.0));
            case CUSTOM -> new Custom(points);
        };
    }

    public static final class Bell extends ShapeParams {
        private final double mu;
        private final double sigma;

        public Bell(double mu, double sigma) {
            if (!(sigma > 0)) {
                throw new InvalidArgumentException("sigma must be positive");
            }
            this.mu = mu;
            this.sigma = sigma;
        }

        @Override
        public ShapeType getType() {
            return ShapeType.BELL;
        }

        @Override
        double rawWeight(int percent) {
            return Math.exp(-Math.pow(percent - mu, 2) / (2 * sigma * sigma));
        }

        @Override
        public Map<String, Double> toMap() {
            Map<String, Double> map = new LinkedHashMap<>();
            map.put("mu", mu);
            map.put("sigma", sigma);
            return map;
        }
    }

    public static final class Flat extends ShapeParams {
        @Override
        public ShapeType getType() {
            return ShapeType.FLAT;
        }

        @Override
        double rawWeight(int percent) {
            return 1.0;
        }

        @Override
        public Map<String, Double> toMap() {
            return new LinkedHashMap<>();
        }
    }

    // Heavy at low prices, fading towards 50%.
    public static final class Exponential extends ShapeParams {
        private final double decay;

        public Exponential(double decay) {
            this.decay = decay;
        }

        @Override
        public ShapeType getType() {
            return ShapeType.EXPONENTIAL;
        }

        @Override
        double rawWeight(int percent) {
            return Math.exp(-decay * percent);
        }

        @Override
        public Map<String, Double> toMap() {
            Map<String, Double> map = new LinkedHashMap<>();
            map.put("decay", decay);
            return map;
        }
    }

    public static final class Logarithmic extends ShapeParams {
        @Override
        public ShapeType getType() {
            return ShapeType.LOGARITHMIC;
        }

        @Override
        double rawWeight(int percent) {
            return Math.log(101 - percent);
        }

        @Override
        public Map<String, Double> toMap() {
            return new LinkedHashMap<>();
        }
    }

    /**
     * Inverted S-curve: high below the midpoint, low above it.
     */
    public static final class Sigmoid extends ShapeParams {
        private final double midpoint;
        private final double steepness;

        public Sigmoid(double midpoint, double steepness) {
            this.midpoint = midpoint;
            this.steepness = steepness;
        }

        @Override
        public ShapeType getType() {
            return ShapeType.SIGMOID;
        }

        @Override
        double rawWeight(int percent) {
            return 1.0 / (1.0 + Math.exp(steepness * (percent - midpoint)));
        }

        @Override
        public Map<String, Double> toMap() {
            Map<String, Double> map = new LinkedHashMap<>();
            map.put("midpoint", midpoint);
            map.put("steepness", steepness);
            return map;
        }
    }

    public static final class Parabolic extends ShapeParams {
        private final double maxPrice;

        public Parabolic(double maxPrice) {
            this.maxPrice = maxPrice;
        }

        @Override
        public ShapeType getType() {
            return ShapeType.PARABOLIC;
        }

        @Override
        double rawWeight(int percent) {
            return Math.pow(Math.max(0, maxPrice - percent), 2);
        }

        @Override
        public Map<String, Double> toMap() {
            Map<String, Double> map = new LinkedHashMap<>();
            map.put("maxPrice", maxPrice);
            return map;
        }
    }

    /**
     * Operator-supplied weights, on their own price points.
     */
    public static final class Custom extends ShapeParams {
        private final Map<Integer, Double> weights = new LinkedHashMap<>();

        public Custom(List<CurvePoint> points) {
            if (points == null || points.isEmpty()) {
                throw new InvalidArgumentException("custom shape needs at least one point");
            }
            List<String> errors = new ArrayList<>();
            for (CurvePoint point : points) {
                if (point.getPrice() < 1 || point.getPrice() > 99) {
                    errors.add("custom point price must be a percent in [1, 99]: " + point.getPrice());
                } else if (!(point.getWeight() >= 0) || Double.isInfinite(point.getWeight())) {
                    errors.add("custom point weight must be non-negative: " + point.getWeight());
                } else if (weights.putIfAbsent(point.getPrice(), point.getWeight()) != null) {
                    errors.add("duplicate custom point price: " + point.getPrice());
                }
            }
            if (!errors.isEmpty()) {
                throw new InvalidArgumentException(errors);
            }
        }

        @Override
        public ShapeType getType() {
            return ShapeType.CUSTOM;
        }

        @Override
        List<Integer> percents() {
            return List.copyOf(weights.keySet());
        }

        @Override
        double rawWeight(int percent) {
            return weights.getOrDefault(percent, 0.0);
        }

        @Override
        public Map<String, Double> toMap() {
            return new LinkedHashMap<>();
        }
    }
}
