package com.prediction.market.exchange.ledger;

import java.util.UUID;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.Transaction;
import com.prediction.market.exchange.entity.TransactionType;
import com.prediction.market.exchange.error.InsufficientFundsException;
import com.prediction.market.exchange.error.NotFoundException;

/**
 * Balance movements. Every debit or credit updates the account and appends
 * the matching transaction log entry in the same session.
 */
public final class LedgerPostings {

    private LedgerPostings() {
    }

    public static Account requireAccount(LedgerSession session, String accountId) {
        return session.findAccount(accountId)
            .orElseThrow(() -> new NotFoundException("Account", accountId));
    }

    public static Market requireMarket(LedgerSession session, String marketId) {
        return session.findMarket(marketId).orElseThrow(() -> new NotFoundException("Market", marketId));
    }

    /**
     * Reserve funds for an operation the caller asked for.
     *
     * @throws InsufficientFundsException if the balance cannot cover it
     */
    public static Account reserve(LedgerSession session, String accountId, long amount,
            TransactionType type, String marketId, String referenceId, long timestamp) {
        Account account = requireAccount(session, accountId);
        if (!account.hasSufficientBalance(amount)) {
            throw new InsufficientFundsException(accountId, amount, account.getBalance());
        }
        return debit(session, account, amount, type, marketId, referenceId, timestamp);
    }

    public static Account debit(LedgerSession session, Account account, long amount,
            TransactionType type, String marketId, String referenceId, long timestamp) {
        account.debit(amount, timestamp);
        session.saveAccount(account);
        append(session, account, -amount, type, marketId, referenceId, timestamp);
        return account;
    }

    public static Account credit(LedgerSession session, String accountId, long amount,
            TransactionType type, String marketId, String referenceId, long timestamp) {
        Account account = requireAccount(session, accountId);
        account.credit(amount, timestamp);
        session.saveAccount(account);
        append(session, account, amount, type, marketId, referenceId, timestamp);
        return account;
    }

    private static void append(LedgerSession session, Account account, long amount,
            TransactionType type, String marketId, String referenceId, long timestamp) {
        session.appendTransaction(Transaction.builder()
            .id(UUID.randomUUID().toString())
            .accountId(account.getId())
            .marketId(marketId)
            .type(type)
            .amount(amount)
            .referenceId(referenceId)
            .timestamp(timestamp)
            .balanceAfter(account.getBalance())
            .build());
    }
}
