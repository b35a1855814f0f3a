package com.prediction.market.exchange.error;

public class InvalidStateException extends ExchangeException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message);
    }
}
