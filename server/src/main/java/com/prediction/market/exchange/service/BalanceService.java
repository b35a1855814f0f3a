package com.prediction.market.exchange.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.Transaction;
import com.prediction.market.exchange.ledger.LedgerSession;
import com.prediction.market.exchange.ledger.LedgerStore;

import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks account balances against the transaction log.
 * The ledger (transactions collection) is the SOURCE OF TRUTH;
 * Account.balance must always equal the sum of the account's movements.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BalanceService {

    private final LedgerStore ledgerStore;

    /**
     * Balance according to the latest transaction's balanceAfter.
     *
     * @param accountId the account ID
     * @return the balance, 0 for an account without movements
     */
    public long computeBalanceFromLedger(String accountId) {
        return ledgerStore.inTransaction(session -> latestBalance(session, accountId));
    }

    /**
     * Balance as the plain sum of all movements.
     * WARNING: This is O(n) and is meant for audits only.
     */
    public long computeBalanceFromLedgerFullScan(String accountId) {
        return ledgerStore.inTransaction(session -> fullScan(session, accountId));
    }

    /**
     * Periodic reconciliation job. Drift is reported, never corrected.
     */
    @Scheduled(fixedDelayString = "${exchange.ledger.reconcile-interval:PT5M}",
        initialDelayString = "${exchange.ledger.reconcile-interval:PT5M}")
    public void reconcileAllBalances() {
        log.info("Starting balance reconciliation from ledger...");

        try {
            List<Drift> drifts = findDrift();
            if (drifts.isEmpty()) {
                log.info("Balance reconciliation complete: no drift");
            } else {
                drifts.forEach(d -> log.error("Balance drift detected for account {}: cached={}, ledger={}",
                    d.getAccountId(), d.getCached(), d.getLedger()));
            }
        } catch (RuntimeException e) {
            log.error("Balance reconciliation failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Accounts whose stored balance disagrees with their transaction log.
     */
    public List<Drift> findDrift() {
        return ledgerStore.inTransaction(session -> {
            List<Drift> drifts = new ArrayList<>();
            for (Account account : session.findAllAccounts()) {
                long ledgerBalance = fullScan(session, account.getId());
                if (ledgerBalance != account.getBalance()) {
                    drifts.add(Drift.builder()
                        .accountId(account.getId())
                        .cached(account.getBalance())
                        .ledger(ledgerBalance)
                        .build());
                }
            }
            return drifts;
        });
    }

    private static long latestBalance(LedgerSession session, String accountId) {
        List<Transaction> transactions = session.findTransactionsByAccount(accountId);
        return transactions.isEmpty() ? 0L : transactions.get(transactions.size() - 1).getBalanceAfter();
    }

    private static long fullScan(LedgerSession session, String accountId) {
        long balance = 0L;
        for (Transaction tx : session.findTransactionsByAccount(accountId)) {
            balance += tx.getAmount(); // positive = credit, negative = debit
        }
        return balance;
    }

    @Value
    @Builder
    public static class Drift {
        String accountId;
        long cached;
        long ledger;
    }
}
