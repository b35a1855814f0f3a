package com.prediction.market.exchange.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.prediction.market.exchange.entity.Account;

class InMemoryLedgerStoreTest {

    private final InMemoryLedgerStore store = new InMemoryLedgerStore();

    private static Account account(String id, long balance) {
        return Account.builder().id(id).balance(balance).build();
    }

    @Test
    void committedWorkIsVisibleToLaterTransactions() {
        store.run(session -> session.saveAccount(account("alice", 100)));

        long balance = store.inTransaction(session -> session.findAccount("alice").orElseThrow().getBalance());

        assertThat(balance).isEqualTo(100);
    }

    @Test
    void failedWorkLeavesNoTrace() {
        // Given
        store.run(session -> session.saveAccount(account("alice", 100)));

        // When: a debit is staged and then the work fails
        assertThatThrownBy(() -> store.run(session -> {
            session.findAccount("alice").orElseThrow().debit(60, 1L);
            session.saveAccount(account("bob", 60));
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class).hasMessage("boom");

        // Then
        assertThat(store.accounts.get("alice").getBalance()).isEqualTo(100);
        assertThat(store.accounts).doesNotContainKey("bob");
    }

    @Test
    void uncommittedChangesDoNotLeakIntoCommittedRows() {
        store.run(session -> session.saveAccount(account("alice", 100)));

        // Mutated but never saved
        store.run(session -> session.findAccount("alice").orElseThrow().credit(50, 1L));

        assertThat(store.accounts.get("alice").getBalance()).isEqualTo(100);
    }

    @Test
    void repeatedReadsReturnTheSameInstance() {
        store.run(session -> session.saveAccount(account("alice", 100)));

        store.run(session -> {
            Account first = session.findAccount("alice").orElseThrow();
            first.credit(5, 1L);
            assertThat(session.findAccount("alice").orElseThrow()).isSameAs(first);
            assertThat(session.findAllAccounts()).extracting(Account::getBalance).containsExactly(105L);
        });
    }

    @Test
    void nestedTransactionsAreRejected() {
        assertThatThrownBy(() -> store.run(outer -> store.run(inner -> { })))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Nested ledger transaction");
    }

    @Test
    void concurrentTransactionsDoNotLoseUpdates() throws InterruptedException {
        store.run(session -> session.saveAccount(account("alice", 0)));
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);

        for (int t = 0; t < threads; t++) {
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    store.run(session -> {
                        Account alice = session.findAccount("alice").orElseThrow();
                        alice.credit(1, 1L);
                        session.saveAccount(alice);
                    });
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(30, TimeUnit.SECONDS)).isTrue();

        assertThat(store.accounts.get("alice").getBalance()).isEqualTo((long) threads * perThread);
    }
}
