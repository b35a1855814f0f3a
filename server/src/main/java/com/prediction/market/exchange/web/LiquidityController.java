package com.prediction.market.exchange.web;

import java.math.BigDecimal;
import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.exchange.entity.CurveShape;
import com.prediction.market.exchange.entity.MarketWeight;
import com.prediction.market.exchange.liquidity.LadderPoint;
import com.prediction.market.exchange.liquidity.OverrideRule;
import com.prediction.market.exchange.service.LiquidityService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Curve shapes, market weights and overrides.
 */
@Slf4j
@RestController
@RequestMapping("/api/liquidity")
@RequiredArgsConstructor
public class LiquidityController {

    private final LiquidityService liquidityService;

    @GetMapping("/shapes")
    public ResponseEntity<List<CurveShape>> shapes() {
        return ResponseEntity.ok(liquidityService.listCurveShapes());
    }

    @PostMapping("/shapes")
    public ResponseEntity<CurveShape> saveShape(@RequestBody CurveShapeRequest request) {
        log.info("api save curve shape name={} type={}", request.getName(), request.getType());
        return ResponseEntity.status(HttpStatus.CREATED).body(liquidityService.saveCurveShape(request.getName(),
            request.getType(), request.getParams(), request.getPoints()));
    }

    @GetMapping("/shapes/default")
    public ResponseEntity<CurveShape> defaultShape() {
        return ResponseEntity.ok(liquidityService.getDefaultCurveShape());
    }

    @GetMapping("/shapes/{shapeId}")
    public ResponseEntity<CurveShape> shape(@PathVariable String shapeId) {
        return ResponseEntity.ok(liquidityService.getCurveShape(shapeId));
    }

    @PutMapping("/shapes/{shapeId}")
    public ResponseEntity<CurveShape> updateShape(@PathVariable String shapeId,
            @RequestBody CurveShapeRequest request) {
        return ResponseEntity.ok(liquidityService.updateCurveShape(shapeId, request.getParams(), request.getPoints()));
    }

    @PostMapping("/shapes/{shapeId}/default")
    public ResponseEntity<CurveShape> setDefault(@PathVariable String shapeId) {
        return ResponseEntity.ok(liquidityService.setDefaultCurveShape(shapeId));
    }

    @DeleteMapping("/shapes/{shapeId}")
    public ResponseEntity<Void> deleteShape(@PathVariable String shapeId) {
        liquidityService.deleteCurveShape(shapeId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/markets/{marketId}/override")
    public ResponseEntity<OverrideRule> override(@PathVariable String marketId) {
        return ResponseEntity.ok(liquidityService.getMarketOverride(marketId));
    }

    @PutMapping("/markets/{marketId}/override")
    public ResponseEntity<OverrideRule> setOverride(@PathVariable String marketId,
            @Valid @RequestBody MarketOverrideRequest request) {
        log.info("api set override marketId={} kind={}", marketId, request.getKind());
        return ResponseEntity.ok(liquidityService.setMarketOverride(marketId, request.toRule()));
    }

    /**
     * @return the ladder, or 204 when the market is disabled for the bot
     */
    @GetMapping("/markets/{marketId}/curve")
    public ResponseEntity<List<LadderPoint>> curve(@PathVariable String marketId) {
        List<LadderPoint> curve = liquidityService.computeEffectiveCurve(marketId);
        return curve == null ? ResponseEntity.noContent().build() : ResponseEntity.ok(curve);
    }

    @GetMapping("/weights")
    public ResponseEntity<List<MarketWeight>> weights() {
        return ResponseEntity.ok(liquidityService.listMarketWeights());
    }

    @PostMapping("/weights/initialize")
    public ResponseEntity<List<MarketWeight>> initializeWeights() {
        return ResponseEntity.ok(liquidityService.initializeMarketWeights());
    }

    @PutMapping("/weights/{marketId}")
    public ResponseEntity<List<MarketWeight>> setWeight(@PathVariable String marketId,
            @Valid @RequestBody MarketWeightRequest request) {
        log.info("api set weight marketId={} weight={} locked={}", marketId, request.getWeight(), request.isLocked());
        return ResponseEntity.ok(liquidityService.setMarketWeight(marketId, request.getWeight(), request.isLocked()));
    }

    @PutMapping("/weights/{marketId}/lock")
    public ResponseEntity<List<MarketWeight>> setLock(@PathVariable String marketId,
            @RequestParam(name = "locked") boolean locked) {
        return ResponseEntity.ok(liquidityService.setWeightLock(marketId, locked));
    }

    @PutMapping("/weights/{marketId}/odds")
    public ResponseEntity<MarketWeight> setOdds(@PathVariable String marketId,
            @RequestParam(name = "odds") BigDecimal odds) {
        return ResponseEntity.ok(liquidityService.setRelativeOdds(marketId, odds));
    }

    @PostMapping("/weights/apply-odds")
    public ResponseEntity<List<MarketWeight>> applyOdds() {
        return ResponseEntity.ok(liquidityService.applyRelativeOdds());
    }
}
