package com.prediction.market.exchange.web;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.Transaction;
import com.prediction.market.exchange.service.TradingService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final TradingService tradingService;

    @PostMapping
    public ResponseEntity<Account> open(@Valid @RequestBody OpenAccountRequest request) {
        log.info("api open account accountId={}", request.getAccountId());
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(tradingService.openAccount(request.getAccountId(), request.getInitialBalance()));
    }

    @PostMapping("/{accountId}/deposit")
    public ResponseEntity<Account> deposit(@PathVariable String accountId, @RequestParam(name = "amount") long amount) {
        log.info("api deposit accountId={} amount={}", accountId, amount);
        return ResponseEntity.ok(tradingService.deposit(accountId, amount));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<Account> get(@PathVariable String accountId) {
        return ResponseEntity.ok(tradingService.getAccount(accountId));
    }

    @GetMapping("/{accountId}/orders")
    public ResponseEntity<List<Order>> openOrders(@PathVariable String accountId) {
        return ResponseEntity.ok(tradingService.getOpenOrders(accountId));
    }

    @GetMapping("/{accountId}/positions")
    public ResponseEntity<List<Position>> positions(@PathVariable String accountId) {
        return ResponseEntity.ok(tradingService.getActivePositions(accountId));
    }

    @GetMapping("/{accountId}/transactions")
    public ResponseEntity<List<Transaction>> transactions(@PathVariable String accountId) {
        return ResponseEntity.ok(tradingService.getTransactions(accountId));
    }
}
