package com.prediction.market.exchange.service;

import org.springframework.stereotype.Service;

import com.prediction.market.exchange.engine.CostModel;
import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Transaction;
import com.prediction.market.exchange.entity.TransactionType;
import com.prediction.market.exchange.ledger.LedgerSession;
import com.prediction.market.exchange.ledger.LedgerStore;

import lombok.RequiredArgsConstructor;

/**
 * Conservation of funds: balances, plus the payout locked in active
 * positions, plus reservations of resting orders, always add up to the
 * money deposited.
 */
@Service
@RequiredArgsConstructor
public class LedgerAudit {

    private final LedgerStore ledgerStore;
    private final CostModel costModel;

    public long conservationTotal() {
        return ledgerStore.inTransaction(this::conservationTotal);
    }

    public long conservationTotal(LedgerSession session) {
        long balances = session.findAllAccounts().stream().mapToLong(Account::getBalance).sum();
        long locked = session.findAllActivePositions().stream()
            .mapToLong((Position p) -> costModel.payout(p.getShares()))
            .sum();
        long reserved = session.findAllActiveOrders().stream().mapToLong(Order::getReservedAmount).sum();
        return balances + locked + reserved;
    }

    public long deposits() {
        return ledgerStore.inTransaction(session -> session.findAllAccounts().stream()
            .flatMap(account -> session.findTransactionsByAccount(account.getId()).stream())
            .filter(tx -> tx.getType() == TransactionType.DEPOSIT)
            .mapToLong(Transaction::getAmount)
            .sum());
    }
}
