package com.prediction.market.exchange.liquidity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.entity.CurvePoint;
import com.prediction.market.exchange.entity.ShapeType;
import com.prediction.market.exchange.error.InvalidArgumentException;

class ShapeGeneratorTest {

    private static double sum(List<CurvePoint> points) {
        return points.stream().mapToDouble(CurvePoint::getWeight).sum();
    }

    private static int peak(List<CurvePoint> points) {
        CurvePoint best = points.get(0);
        for (CurvePoint p : points) {
            if (p.getWeight() > best.getWeight()) {
                best = p;
            }
        }
        return best.getPrice();
    }

    @Test
    void everyBuiltInShapeIsNormalizedOverTheLadder() {
        for (ShapeType type : ShapeType.values()) {
            if (type == ShapeType.CUSTOM) {
                continue;
            }
            List<CurvePoint> points = ShapeGenerator.generate(ShapeParams.of(type, Map.of(), null));

            assertThat(points).extracting(CurvePoint::getPrice).containsExactlyElementsOf(PricePoints.PERCENTS);
            assertThat(sum(points)).as(type.name()).isCloseTo(1.0, within(1e-9));
        }
    }

    @Test
    void flatSplitsEvenly() {
        List<CurvePoint> points = ShapeGenerator.generate(ShapeParams.of(ShapeType.FLAT, null, null));

        assertThat(points).allSatisfy(p -> assertThat(p.getWeight()).isCloseTo(0.1, within(1e-12)));
    }

    @Test
    void bellPeaksAtMu() {
        assertThat(peak(ShapeGenerator.generate(ShapeParams.of(ShapeType.BELL, Map.of(), null)))).isEqualTo(20);
        assertThat(peak(ShapeGenerator.generate(ShapeParams.of(ShapeType.BELL, Map.of("mu", 35.0), null))))
            .isEqualTo(35);
    }

    @Test
    void decayingShapesFavourLowPrices() {
        assertThat(peak(ShapeGenerator.generate(ShapeParams.of(ShapeType.EXPONENTIAL, Map.of(), null)))).isEqualTo(5);
        assertThat(peak(ShapeGenerator.generate(ShapeParams.of(ShapeType.SIGMOID, Map.of(), null)))).isEqualTo(5);
        assertThat(peak(ShapeGenerator.generate(ShapeParams.of(ShapeType.PARABOLIC, Map.of(), null)))).isEqualTo(5);
    }

    @Test
    void customPointsAreNormalizedOnTheirOwnPrices() {
        List<CurvePoint> custom = List.of(new CurvePoint(10, 3), new CurvePoint(30, 1));

        List<CurvePoint> points = ShapeGenerator.generate(ShapeParams.of(ShapeType.CUSTOM, null, custom));

        assertThat(points).extracting(CurvePoint::getPrice).containsExactly(10, 30);
        assertThat(points.get(0).getWeight()).isCloseTo(0.75, within(1e-12));
        assertThat(points.get(1).getWeight()).isCloseTo(0.25, within(1e-12));
    }

    @Test
    void invalidParametersAreRejected() {
        assertThatThrownBy(() -> ShapeParams.of(ShapeType.BELL, Map.of("sigma", 0.0), null))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ShapeParams.of(ShapeType.CUSTOM, null, List.of()))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ShapeParams.of(ShapeType.CUSTOM, null,
            List.of(new CurvePoint(10, 1), new CurvePoint(10, 2))))
            .isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(() -> ShapeParams.of(ShapeType.CUSTOM, null, List.of(new CurvePoint(100, 1))))
            .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void allZeroShapeGivesZeroWeights() {
        List<CurvePoint> points = ShapeGenerator.normalize(List.of(new CurvePoint(10, 0), new CurvePoint(20, 0)));

        assertThat(points).allSatisfy(p -> assertThat(p.getWeight()).isZero());
    }
}
