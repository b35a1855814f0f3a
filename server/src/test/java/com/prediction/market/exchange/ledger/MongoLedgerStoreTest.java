package com.prediction.market.exchange.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.mongodb.MongoException;
import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.error.InvalidStateException;
import com.prediction.market.exchange.repositories.AccountRepository;
import com.prediction.market.exchange.repositories.MarketRepository;

/**
 * Retry and identity behaviour of the Mongo ledger, with the transaction
 * manager and repositories mocked out.
 */
class MongoLedgerStoreTest {

    private PlatformTransactionManager transactionManager;
    private MongoLedgerRepositories repositories;
    private MongoLedgerStore store;

    @BeforeEach
    void setUp() {
        transactionManager = mock(PlatformTransactionManager.class);
        repositories = mock(MongoLedgerRepositories.class);
        store = new MongoLedgerStore(new TransactionTemplate(transactionManager), repositories,
            new LedgerRetryPolicy(3, 0, 0));
    }

    @Test
    void writeConflictsAreRetriedOnAFreshSession() {
        AtomicInteger attempts = new AtomicInteger();

        String result = store.inTransaction(session -> {
            if (attempts.incrementAndGet() < 3) {
                throw new OptimisticLockingFailureException("stale version");
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(attempts).hasValue(3);
        verify(transactionManager, times(2)).rollback(any());
    }

    @Test
    void retriesAreBounded() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> store.run(session -> {
            attempts.incrementAndGet();
            MongoException transientError = new MongoException("write conflict");
            transientError.addLabel("TransientTransactionError");
            throw transientError;
        })).isInstanceOf(MongoException.class);

        assertThat(attempts).hasValue(3);
    }

    @Test
    void domainErrorsAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> store.run(session -> {
            attempts.incrementAndGet();
            throw new InvalidStateException("market closed");
        })).isInstanceOf(InvalidStateException.class);

        assertThat(attempts).hasValue(1);
    }

    @Test
    void repeatedReadsInOneTransactionShareTheDocument() {
        AccountRepository accounts = mock(AccountRepository.class);
        when(repositories.getAccounts()).thenReturn(accounts);
        when(accounts.findById("alice"))
            .thenAnswer(invocation -> Optional.of(Account.builder().id("alice").balance(100).build()));

        boolean same = store.inTransaction(session ->
            session.findAccount("alice").orElseThrow() == session.findAccount("alice").orElseThrow());

        assertThat(same).isTrue();
    }

    @Test
    void identityMapKeepsDocumentTypesApart() {
        // Given: an account and a market sharing one id
        AccountRepository accounts = mock(AccountRepository.class);
        MarketRepository markets = mock(MarketRepository.class);
        when(repositories.getAccounts()).thenReturn(accounts);
        when(repositories.getMarkets()).thenReturn(markets);
        Account saved = Account.builder().id("shared").balance(250).build();
        when(accounts.save(any(Account.class))).thenReturn(saved);
        when(accounts.findById("shared"))
            .thenAnswer(invocation -> Optional.of(Account.builder().id("shared").balance(0).build()));
        when(markets.findById("shared"))
            .thenAnswer(invocation -> Optional.of(Market.builder().id("shared").title("Shared").build()));

        // When
        store.run(session -> {
            session.saveAccount(saved);
            Market market = session.findMarket("shared").orElseThrow();
            Account account = session.findAccount("shared").orElseThrow();

            // Then: each read returns its own type, the account as last saved
            assertThat(market.getTitle()).isEqualTo("Shared");
            assertThat(account).isSameAs(saved);
            assertThat(account.getBalance()).isEqualTo(250);
        });
    }
}
