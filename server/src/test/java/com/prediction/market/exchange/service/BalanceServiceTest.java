package com.prediction.market.exchange.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.TestExchange;
import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.Side;

class BalanceServiceTest {

    private TestExchange exchange;
    private BalanceService balances;

    @BeforeEach
    void setUp() {
        exchange = new TestExchange(false);
        balances = exchange.balances;
        exchange.trading.createMarket("m1", "Will it rain?");
        exchange.trading.openAccount("alice", 100_000);
        exchange.trading.openAccount("bob", 100_000);
        exchange.trading.placeOrder("alice", "m1", Side.NO, 400, 10);
        exchange.trading.placeOrder("bob", "m1", Side.YES, 700, 10);
        exchange.trading.placeOrder("alice", "m1", Side.YES, 200, 3);
    }

    @AfterEach
    void tearDown() {
        exchange.shutdown();
    }

    @Test
    void ledgerAgreesWithStoredBalances() {
        for (String account : List.of("alice", "bob")) {
            long stored = exchange.trading.getAccount(account).getBalance();
            assertThat(balances.computeBalanceFromLedger(account)).isEqualTo(stored);
            assertThat(balances.computeBalanceFromLedgerFullScan(account)).isEqualTo(stored);
        }
        assertThat(balances.findDrift()).isEmpty();
    }

    @Test
    void accountWithoutMovementsHasZeroBalance() {
        assertThat(balances.computeBalanceFromLedger("nobody")).isZero();
        assertThat(balances.computeBalanceFromLedgerFullScan("nobody")).isZero();
    }

    @Test
    void driftIsReportedButNotCorrected() {
        // Given: a stored balance changed behind the ledger's back
        exchange.store.run(session -> {
            Account alice = session.findAccount("alice").orElseThrow();
            alice.setBalance(alice.getBalance() + 1);
            session.saveAccount(alice);
        });
        long tampered = exchange.trading.getAccount("alice").getBalance();

        // When
        balances.reconcileAllBalances();

        // Then
        assertThat(balances.findDrift()).singleElement().satisfies(drift -> {
            assertThat(drift.getAccountId()).isEqualTo("alice");
            assertThat(drift.getCached()).isEqualTo(tampered);
            assertThat(drift.getLedger()).isEqualTo(tampered - 1);
        });
        assertThat(exchange.trading.getAccount("alice").getBalance()).isEqualTo(tampered);
    }
}
