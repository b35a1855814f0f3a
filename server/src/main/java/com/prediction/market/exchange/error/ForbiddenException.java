package com.prediction.market.exchange.error;

public class ForbiddenException extends ExchangeException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
