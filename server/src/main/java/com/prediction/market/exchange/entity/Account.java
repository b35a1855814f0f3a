package com.prediction.market.exchange.entity;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import com.prediction.market.exchange.error.InvariantViolationException;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Trading account. {@code balance} is the available (unreserved) amount in
 * the smallest currency unit and never goes below zero.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "accounts")
public class Account {

    @MongoId
    private String id;

    private long balance;

    private long createdAt;

    private long updatedAt;

    @Version
    private Long version;

    public boolean hasSufficientBalance(long amount) {
        return balance >= amount;
    }

    public void debit(long amount, long timestamp) {
        if (amount < 0) {
            throw new InvariantViolationException("negative debit " + amount + " on account " + id);
        }
        if (amount > balance) {
            throw new InvariantViolationException(
                String.format("balance of %s would go negative: %d - %d", id, balance, amount));
        }
        balance -= amount;
        updatedAt = timestamp;
    }

    public void credit(long amount, long timestamp) {
        if (amount < 0) {
            throw new InvariantViolationException("negative credit " + amount + " on account " + id);
        }
        balance = Math.addExact(balance, amount);
        updatedAt = timestamp;
    }

    public Account copy() {
        return toBuilder().build();
    }
}
