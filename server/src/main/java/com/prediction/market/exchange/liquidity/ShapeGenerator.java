package com.prediction.market.exchange.liquidity;

import java.util.ArrayList;
import java.util.List;

import com.prediction.market.exchange.entity.CurvePoint;

/**
 * Turns shape parameters into normalized points whose weights sum to 1.0.
 * A shape that is zero everywhere yields zero weights.
 */
public final class ShapeGenerator {

    private ShapeGenerator() {
    }

    public static List<CurvePoint> generate(ShapeParams params) {
        List<Integer> percents = params.percents();
        double[] raw = new double[percents.size()];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = params.rawWeight(percents.get(i));
        }
        return normalize(percents, raw);
    }

    public static List<CurvePoint> normalize(List<Integer> percents, double[] raw) {
        double sum = 0;
        for (double value : raw) {
            sum += value;
        }
        List<CurvePoint> points = new ArrayList<>(raw.length);
        for (int i = 0; i < raw.length; i++) {
            points.add(new CurvePoint(percents.get(i), sum > 0 ? raw[i] / sum : 0.0));
        }
        return points;
    }

    public static List<CurvePoint> normalize(List<CurvePoint> points) {
        List<Integer> percents = new ArrayList<>(points.size());
        double[] raw = new double[points.size()];
        for (int i = 0; i < raw.length; i++) {
            percents.add(points.get(i).getPrice());
            raw[i] = points.get(i).getWeight();
        }
        return normalize(percents, raw);
    }
}
