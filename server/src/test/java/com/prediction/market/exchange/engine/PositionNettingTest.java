package com.prediction.market.exchange.engine;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.TestExchange;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Side;

class PositionNettingTest {

    private static final String MARKET = "m1";

    private TestExchange exchange;

    @BeforeEach
    void setUp() {
        exchange = new TestExchange(false);
        exchange.trading.createMarket(MARKET, "Netting");
        for (String account : List.of("alice", "bob", "carol")) {
            exchange.trading.openAccount(account, 100_000);
        }
        // bob goes short against alice: alice YES, bob NO, 10 shares at YES price 600
        exchange.trading.placeOrder("alice", MARKET, Side.YES, 600, 10);
        exchange.trading.placeOrder("bob", MARKET, Side.NO, 400, 10);
    }

    @AfterEach
    void tearDown() {
        exchange.shutdown();
    }

    @Test
    void offsettingPositionsAreNettedAndCounterpartiesRebound() {
        // Given: carol rests NO at 400
        exchange.trading.placeOrder("carol", MARKET, Side.NO, 400, 10);

        // When: bob buys 10 YES, now holding both sides
        OrderResult result = exchange.trading.placeOrder("bob", MARKET, Side.YES, 700, 10);

        // Then: bob nets 10 shares and is credited 10 × 1000
        assertThat(result.getAutoSettlements()).hasSize(1);
        AutoSettlement settlement = result.getAutoSettlements().get(0);
        assertThat(settlement.getAccountId()).isEqualTo("bob");
        assertThat(settlement.getNettedShares()).isEqualTo(10);
        assertThat(settlement.getCredited()).isEqualTo(10_000);
        assertThat(settlement.getSettledPositionIds()).hasSize(2);
        assertThat(exchange.trading.getActivePositions("bob")).isEmpty();
        assertThat(exchange.trading.getAccount("bob").getBalance()).isEqualTo(100_000);

        // And: alice and carol now face each other directly
        assertThat(settlement.getNovatedPositions()).hasSize(1);
        Position bound = settlement.getNovatedPositions().get(0);
        assertThat(bound.getYesAccountId()).isEqualTo("alice");
        assertThat(bound.getNoAccountId()).isEqualTo("carol");
        assertThat(bound.getShares()).isEqualTo(10);
        assertThat(bound.getTradePrice()).isEqualTo(600);

        assertThat(exchange.audit.conservationTotal()).isEqualTo(exchange.audit.deposits());
    }

    @Test
    void partialNettingSplitsTheLargerLeg() {
        exchange.trading.placeOrder("carol", MARKET, Side.NO, 400, 4);

        OrderResult result = exchange.trading.placeOrder("bob", MARKET, Side.YES, 700, 4);

        assertThat(result.getAutoSettlements()).singleElement()
            .satisfies(s -> assertThat(s.getNettedShares()).isEqualTo(4));
        List<Position> remaining = exchange.trading.getActivePositions("bob");
        assertThat(remaining).singleElement().satisfies(p -> {
            assertThat(p.getShares()).isEqualTo(6);
            assertThat(p.getNoAccountId()).isEqualTo("bob");
            assertThat(p.getYesAccountId()).isEqualTo("alice");
            assertThat(p.getParentPositionId()).isNotNull();
        });

        // alice's claim is 6 against bob plus 4 against carol
        assertThat(exchange.trading.getActivePositions("alice"))
            .extracting(Position::getShares)
            .containsExactlyInAnyOrder(6, 4);
        assertThat(exchange.audit.conservationTotal()).isEqualTo(exchange.audit.deposits());
    }

    @Test
    void nettedAccountEndsFlatWhateverTheOutcome() {
        exchange.trading.placeOrder("carol", MARKET, Side.NO, 400, 10);
        exchange.trading.placeOrder("bob", MARKET, Side.YES, 700, 10);
        long bobBefore = exchange.trading.getAccount("bob").getBalance();

        exchange.resolution.resolveMarket(MARKET, Side.YES);

        assertThat(exchange.trading.getAccount("bob").getBalance()).isEqualTo(bobBefore);
        // alice paid 6,000 and wins 10,000; carol paid 4,000 and loses it
        assertThat(exchange.trading.getAccount("alice").getBalance()).isEqualTo(104_000);
        assertThat(exchange.trading.getAccount("carol").getBalance()).isEqualTo(96_000);
    }
}
