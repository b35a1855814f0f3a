package com.prediction.market.exchange.error;

public class NotFoundException extends ExchangeException {

    public NotFoundException(String entity, String id) {
        super(ErrorKind.NOT_FOUND, entity + " not found: " + id);
    }
}
