package com.prediction.market.exchange.error;

import java.util.List;

public class InvalidArgumentException extends ExchangeException {

    private final List<String> errors;

    public InvalidArgumentException(String message) {
        this(List.of(message));
    }

    public InvalidArgumentException(List<String> errors) {
        super(ErrorKind.INVALID_ARGUMENT, String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
