package com.prediction.market.exchange.web;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.exchange.engine.CancelResult;
import com.prediction.market.exchange.engine.OrderResult;
import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.service.TradingService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Order entry. The caller identifies itself with the {@value #ACCOUNT_HEADER} header.
 */
@Slf4j
@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderController {

    public static final String ACCOUNT_HEADER = "X-Account-Id";

    private final TradingService tradingService;

    @PostMapping
    public ResponseEntity<OrderResult> place(@RequestHeader(ACCOUNT_HEADER) String accountId,
            @Valid @RequestBody PlaceOrderRequest request) {
        log.info("api place order accountId={} marketId={} side={} price={} shares={}",
            accountId, request.getMarketId(), request.getSide(), request.getPrice(), request.getShares());
        return ResponseEntity.ok(tradingService.placeOrder(accountId, request.getMarketId(), request.getSide(),
            request.getPrice(), request.getShares()));
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<Order> get(@PathVariable String orderId) {
        return ResponseEntity.ok(tradingService.getOrder(orderId));
    }

    @DeleteMapping("/{orderId}")
    public ResponseEntity<CancelResult> cancel(@RequestHeader(ACCOUNT_HEADER) String accountId,
            @PathVariable String orderId) {
        log.info("api cancel order accountId={} orderId={}", accountId, orderId);
        return ResponseEntity.ok(tradingService.cancelOrder(accountId, orderId));
    }

    @DeleteMapping
    public ResponseEntity<CancelResult> cancelAll(@RequestHeader(ACCOUNT_HEADER) String accountId) {
        log.info("api cancel all orders accountId={}", accountId);
        return ResponseEntity.ok(tradingService.cancelAllOrders(accountId));
    }
}
