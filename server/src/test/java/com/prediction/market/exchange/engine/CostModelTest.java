package com.prediction.market.exchange.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Side;

class CostModelTest {

    private final CostModel costModel = new CostModel(1000);

    @Test
    void priceRangeExcludesZeroAndPayout() {
        assertThat(costModel.isValidPrice(0)).isFalse();
        assertThat(costModel.isValidPrice(1)).isTrue();
        assertThat(costModel.isValidPrice(999)).isTrue();
        assertThat(costModel.isValidPrice(1000)).isFalse();
    }

    @Test
    void complementaryPricesCross() {
        assertThat(costModel.crosses(600, 400)).isTrue();
        assertThat(costModel.crosses(700, 400)).isTrue();
        assertThat(costModel.crosses(599, 400)).isFalse();
    }

    @Test
    void takerPaysComplementOfMakerPrice() {
        // Given: a NO maker at 400
        // When: a YES taker crosses it
        // Then: the taker pays 600 per share and the YES trade price is 600
        assertThat(costModel.takerPricePerShare(400)).isEqualTo(600);
        assertThat(costModel.yesTradePrice(Side.YES, 400)).isEqualTo(600);

        // A NO taker against a YES maker at 650 records the maker's price.
        assertThat(costModel.yesTradePrice(Side.NO, 650)).isEqualTo(650);
    }

    @Test
    void bothSidesPaidInAddUpToPayout() {
        Position position = Position.builder().tradePrice(620).shares(7).build();

        long yes = costModel.paidIn(position, Side.YES);
        long no = costModel.paidIn(position, Side.NO);

        assertThat(yes).isEqualTo(4340);
        assertThat(no).isEqualTo(2660);
        assertThat(yes + no).isEqualTo(costModel.payout(7));
    }

    @Test
    void payoutUnitBelowTwoIsRejected() {
        assertThatThrownBy(() -> new CostModel(1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reservationIsComputedInLongs() {
        assertThat(costModel.reservation(999, Integer.MAX_VALUE)).isEqualTo(999L * Integer.MAX_VALUE);
    }
}
