package com.prediction.market.exchange.entity;

import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
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
 * Limit order: an offer to take one side of a market for {@code shares}
 * shares at {@code price} per share.
 *
 * While the order rests in the book, {@code remainingShares × price} of the
 * owner's balance is reserved. Matches, cancellation, pullback shrinking and
 * market resolution are the only mutations; orders are never deleted.
 *
 * IMPORTANT: filledShares never exceeds shares.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "orders")
@CompoundIndex(name = "book_idx", def = "{'marketId':1,'side':1,'status':1,'price':-1,'createdAt':1}")
@CompoundIndex(name = "account_status_idx", def = "{'accountId':1,'status':1,'marketId':1}")
public class Order {

    @MongoId
    private String id;

    @Indexed
    private String accountId;

    @Indexed
    private String marketId;

    private Side side;

    /**
     * What this side pays per share, in [1, P-1].
     */
    private int price;

    /**
     * Total shares. Only pullback shrinking lowers it, never below filledShares.
     */
    private int shares;

    @Builder.Default
    private int filledShares = 0;

    @Builder.Default
    private OrderStatus status = OrderStatus.OPEN;

    /**
     * Monotonic creation time, the tie breaker for price-time priority.
     */
    private long createdAt;

    private long updatedAt;

    /**
     * Set when the order reaches FILLED or CANCELLED.
     */
    private Long completedAt;

    @Version
    private Long version;

    // ===== State Machine Methods =====

    public void transitionTo(OrderStatus newStatus, long timestamp) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new InvariantViolationException(
                String.format("Invalid order state transition: %s → %s (orderId=%s)",
                    this.status, newStatus, this.id));
        }

        this.status = newStatus;
        this.updatedAt = timestamp;

        if (newStatus.isTerminal()) {
            this.completedAt = timestamp;
        }
    }

    /**
     * Record a match of {@code quantity} shares.
     */
    public void fill(int quantity, long timestamp) {
        if (quantity <= 0) {
            throw new InvariantViolationException("Fill quantity must be positive (orderId=" + id + ")");
        }
        if (quantity > getRemainingShares()) {
            throw new InvariantViolationException(
                String.format("Overfill: %d + %d > %d (orderId=%s)", filledShares, quantity, shares, id));
        }

        this.filledShares += quantity;

        if (this.filledShares == this.shares) {
            transitionTo(OrderStatus.FILLED, timestamp);
        } else if (this.status == OrderStatus.OPEN) {
            transitionTo(OrderStatus.PARTIAL, timestamp);
        } else {
            this.updatedAt = timestamp;
        }
    }

    /**
     * Release the unfilled remainder.
     *
     * @return the reservation that is no longer needed
     */
    public long cancel(long timestamp) {
        long released = getReservedAmount();
        transitionTo(OrderStatus.CANCELLED, timestamp);
        return released;
    }

    /**
     * Shrink the unfilled remainder to {@code newRemaining} shares.
     *
     * @return the reservation that is no longer needed
     */
    public long shrinkTo(int newRemaining, long timestamp) {
        int remaining = getRemainingShares();
        if (newRemaining < 0 || newRemaining > remaining) {
            throw new InvariantViolationException(
                String.format("Cannot shrink order %s from %d to %d remaining", id, remaining, newRemaining));
        }
        if (newRemaining == 0) {
            return cancel(timestamp);
        }
        long released = (long) (remaining - newRemaining) * price;
        this.shares = this.filledShares + newRemaining;
        this.updatedAt = timestamp;
        return released;
    }

    public int getRemainingShares() {
        return this.shares - this.filledShares;
    }

    /**
     * Balance still held for the unfilled shares at the limit price.
     */
    public long getReservedAmount() {
        return isActive() ? (long) getRemainingShares() * price : 0L;
    }

    public boolean isActive() {
        return this.status.isActive();
    }

    public Order copy() {
        return toBuilder().build();
    }
}
