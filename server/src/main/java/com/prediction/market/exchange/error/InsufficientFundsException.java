package com.prediction.market.exchange.error;

/**
 * The account cannot cover the reservation an operation needs.
 * Carries both amounts so the caller can top up or resize.
 */
public class InsufficientFundsException extends ExchangeException {

    private final String accountId;
    private final long required;
    private final long available;

    public InsufficientFundsException(String accountId, long required, long available) {
        super(ErrorKind.INSUFFICIENT_FUNDS,
            String.format("Insufficient balance for %s: need %d, have %d", accountId, required, available));
        this.accountId = accountId;
        this.required = required;
        this.available = available;
    }

    public String getAccountId() {
        return accountId;
    }

    public long getRequired() {
        return required;
    }

    public long getAvailable() {
        return available;
    }

    public long getShortfall() {
        return required - available;
    }
}
