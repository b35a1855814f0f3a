package com.prediction.market.exchange.engine;

import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Side;

/**
 * Integer pricing for complementary YES/NO orders. A share pays {@code P}
 * to the winning side; an order price is what its side pays per share.
 * A YES order at {@code y} and a NO order at {@code n} cross when
 * {@code y + n >= P}. No rounding anywhere: every amount is an exact
 * product of integers.
 */
public class CostModel {

    private final int payoutUnit;

    public CostModel(int payoutUnit) {
        if (payoutUnit < 2) {
            throw new IllegalArgumentException("payout unit must be at least 2, got " + payoutUnit);
        }
        this.payoutUnit = payoutUnit;
    }

    public int getPayoutUnit() {
        return payoutUnit;
    }

    public int getMinPrice() {
        return 1;
    }

    public int getMaxPrice() {
        return payoutUnit - 1;
    }

    public boolean isValidPrice(int price) {
        return price >= getMinPrice() && price <= getMaxPrice();
    }

    // Most an order can cost: its limit price on every share.
    public long reservation(int price, int shares) {
        return Math.multiplyExact((long) price, (long) shares);
    }

    public boolean crosses(int takerPrice, int makerPrice) {
        return takerPrice + makerPrice >= payoutUnit;
    }

    /**
     * Per-share cost to a taker matched against a maker at {@code makerPrice}.
     * The maker keeps its own price; the taker pays the complement.
     */
    public int takerPricePerShare(int makerPrice) {
        return payoutUnit - makerPrice;
    }

    /**
     * Position trade price is always recorded from the YES side.
     */
    public int yesTradePrice(Side takerSide, int makerPrice) {
        return takerSide == Side.YES ? takerPricePerShare(makerPrice) : makerPrice;
    }

    public int complement(int price) {
        return payoutUnit - price;
    }

    public long payout(int shares) {
        return Math.multiplyExact((long) shares, (long) payoutUnit);
    }

    /**
     * What one side of a position paid in, returned to it if the market is cancelled.
     */
    public long paidIn(Position position, Side side) {
        int perShare = side == Side.YES ? position.getTradePrice() : complement(position.getTradePrice());
        return (long) perShare * position.getShares();
    }
}
