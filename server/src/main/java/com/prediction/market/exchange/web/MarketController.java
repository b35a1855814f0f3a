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

import com.prediction.market.exchange.engine.ResolutionResult;
import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.ResolutionLog;
import com.prediction.market.exchange.service.OrderBookView;
import com.prediction.market.exchange.service.ResolutionService;
import com.prediction.market.exchange.service.TradingService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/markets")
@RequiredArgsConstructor
public class MarketController {

    private final TradingService tradingService;
    private final ResolutionService resolutionService;

    @PostMapping
    public ResponseEntity<Market> create(@Valid @RequestBody CreateMarketRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(tradingService.createMarket(request.getMarketId(), request.getTitle()));
    }

    @GetMapping("/{marketId}")
    public ResponseEntity<Market> get(@PathVariable String marketId) {
        return ResponseEntity.ok(tradingService.getMarket(marketId));
    }

    @GetMapping("/{marketId}/book")
    public ResponseEntity<OrderBookView> book(@PathVariable String marketId) {
        return ResponseEntity.ok(tradingService.getOrderBook(marketId));
    }

    @GetMapping("/{marketId}/trades")
    public ResponseEntity<List<Position>> trades(@PathVariable String marketId,
            @RequestParam(name = "limit", required = false, defaultValue = "50") int limit) {
        return ResponseEntity.ok(tradingService.getRecentTrades(marketId, limit));
    }

    @PostMapping("/{marketId}/resolve")
    public ResponseEntity<ResolutionResult> resolve(@PathVariable String marketId,
            @Valid @RequestBody ResolveMarketRequest request) {
        log.info("api resolve marketId={} outcome={}", marketId, request.getOutcome());
        return ResponseEntity.ok(resolutionService.resolveMarket(marketId, request.getOutcome()));
    }

    @PostMapping("/{marketId}/resolution")
    public ResponseEntity<ResolutionLog> initiateResolution(@PathVariable String marketId,
            @Valid @RequestBody ResolveMarketRequest request) {
        log.info("api initiate resolution marketId={} outcome={}", marketId, request.getOutcome());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(resolutionService.initiateResolution(marketId, request.getOutcome(), request.getNotes()));
    }

    @PostMapping("/{marketId}/resolution/confirm")
    public ResponseEntity<ResolutionResult> confirmResolution(@PathVariable String marketId,
            @RequestParam(name = "emergency", required = false, defaultValue = "false") boolean emergency) {
        log.info("api confirm resolution marketId={} emergency={}", marketId, emergency);
        return ResponseEntity.ok(resolutionService.confirmResolution(marketId, emergency));
    }

    @PostMapping("/{marketId}/resolution/abort")
    public ResponseEntity<Market> abortResolution(@PathVariable String marketId) {
        log.info("api abort resolution marketId={}", marketId);
        return ResponseEntity.ok(resolutionService.abortResolution(marketId));
    }

    @PostMapping("/{marketId}/cancel")
    public ResponseEntity<ResolutionResult> cancel(@PathVariable String marketId) {
        log.info("api cancel market marketId={}", marketId);
        return ResponseEntity.ok(resolutionService.cancelMarket(marketId));
    }
}
