package com.prediction.market.exchange.entity;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Append-only audit record of one balance movement.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "transactions")
@CompoundIndex(name = "account_timestamp_idx", def = "{'accountId':1,'timestamp':-1}")
public class Transaction {
    @MongoId
    private String id;

    @Indexed
    private String accountId;

    private String marketId;
    private TransactionType type;
    private long amount; // positive for credit, negative for debit

    /**
     * Order or position the movement belongs to.
     */
    private String referenceId;

    private long timestamp;

    /**
     * Running balance after this transaction.
     * balanceAfter = balanceBefore + amount
     */
    private long balanceAfter;

    public Transaction copy() {
        return toBuilder().build();
    }
}
