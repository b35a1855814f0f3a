package com.prediction.market.exchange.service;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Service;

import com.prediction.market.exchange.config.ExchangeProperties;
import com.prediction.market.exchange.engine.CostModel;
import com.prediction.market.exchange.engine.PlaceOrderCommand;

import lombok.extern.slf4j.Slf4j;

/**
 * Strict order validation, before any state is read.
 *
 * All problems are collected and reported together. Market state and
 * balance are checked later, inside the transaction that places the order.
 */
@Slf4j
@Service
public class OrderValidator {

    private final CostModel costModel;
    private final int maxShares;

    public OrderValidator(CostModel costModel, ExchangeProperties properties) {
        this.costModel = costModel;
        this.maxShares = properties.getMatching().getMaxShares();
    }

    /**
     * Result of order validation.
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<String> errors;

        private ValidationResult(boolean valid, List<String> errors) {
            this.valid = valid;
            this.errors = errors;
        }

        public static ValidationResult valid() {
            return new ValidationResult(true, List.of());
        }

        public static ValidationResult invalid(List<String> errors) {
            return new ValidationResult(false, List.copyOf(errors));
        }

        public boolean isValid() {
            return valid;
        }

        public List<String> getErrors() {
            return errors;
        }

        public String getErrorMessage() {
            return String.join("; ", errors);
        }
    }

    public ValidationResult validate(PlaceOrderCommand command) {
        List<String> errors = new ArrayList<>();

        validateFields(command, errors);
        validatePrice(command, errors);
        validateShares(command, errors);

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        }
        log.warn("Order validation failed: {} (accountId={}, marketId={})",
            errors, command.getAccountId(), command.getMarketId());
        return ValidationResult.invalid(errors);
    }

    private void validateFields(PlaceOrderCommand command, List<String> errors) {
        if (command.getAccountId() == null || command.getAccountId().trim().isEmpty()) {
            errors.add("accountId is required");
        }
        if (command.getMarketId() == null || command.getMarketId().trim().isEmpty()) {
            errors.add("marketId is required");
        }
        if (command.getSide() == null) {
            errors.add("side must be YES or NO");
        }
    }

    private void validatePrice(PlaceOrderCommand command, List<String> errors) {
        if (!costModel.isValidPrice(command.getPrice())) {
            errors.add(String.format("Price must be between %d and %d", costModel.getMinPrice(), costModel.getMaxPrice()));
        }
    }

    private void validateShares(PlaceOrderCommand command, List<String> errors) {
        if (command.getShares() < 1) {
            errors.add("Shares must be at least 1");
        }
        if (command.getShares() > maxShares) {
            errors.add(String.format("Shares cannot exceed %d", maxShares));
        }
    }
}
