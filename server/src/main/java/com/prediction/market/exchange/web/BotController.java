package com.prediction.market.exchange.web;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.prediction.market.exchange.bot.BotConfigPatch;
import com.prediction.market.exchange.bot.BotStats;
import com.prediction.market.exchange.bot.DeployAllResult;
import com.prediction.market.exchange.bot.DeploymentPreview;
import com.prediction.market.exchange.bot.DeploymentResult;
import com.prediction.market.exchange.bot.WorstCase;
import com.prediction.market.exchange.engine.CancelResult;
import com.prediction.market.exchange.entity.BotActionLog;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.risk.ExposureView;
import com.prediction.market.exchange.service.BotService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api/bot")
@RequiredArgsConstructor
public class BotController {

    private final BotService botService;

    @GetMapping("/config")
    public ResponseEntity<BotConfig> config() {
        return ResponseEntity.ok(botService.getBotConfig());
    }

    @PatchMapping("/config")
    public ResponseEntity<BotConfig> updateConfig(@RequestBody BotConfigPatch patch) {
        log.info("api update bot config");
        return ResponseEntity.ok(botService.updateBotConfig(patch));
    }

    @GetMapping("/exposure")
    public ResponseEntity<ExposureView> exposure() {
        return ResponseEntity.ok(botService.getExposure());
    }

    @GetMapping("/stats")
    public ResponseEntity<BotStats> stats() {
        return ResponseEntity.ok(botService.getStats());
    }

    @GetMapping("/worst-case")
    public ResponseEntity<WorstCase> worstCase() {
        return ResponseEntity.ok(botService.getWorstCase());
    }

    @GetMapping("/activity")
    public ResponseEntity<List<BotActionLog>> activity(
            @RequestParam(name = "limit", required = false, defaultValue = "50") int limit) {
        return ResponseEntity.ok(botService.getActivityLog(limit));
    }

    @PostMapping("/deploy/{marketId}")
    public ResponseEntity<DeploymentResult> deploy(@PathVariable String marketId,
            @Valid @RequestBody FundingRequest request) {
        log.info("api deploy marketId={} fundingAccountId={}", marketId, request.getFundingAccountId());
        return ResponseEntity.ok(botService.deployMarket(marketId, request.getFundingAccountId()));
    }

    @PostMapping("/deploy")
    public ResponseEntity<DeployAllResult> deployAll(@Valid @RequestBody FundingRequest request) {
        log.info("api deploy all fundingAccountId={}", request.getFundingAccountId());
        return ResponseEntity.ok(botService.deployAllMarkets(request.getFundingAccountId()));
    }

    @GetMapping("/deploy/preview")
    public ResponseEntity<DeploymentPreview> preview(@RequestParam(name = "fundingAccountId") String fundingAccountId) {
        return ResponseEntity.ok(botService.previewDeployment(fundingAccountId));
    }

    @PostMapping("/withdraw")
    public ResponseEntity<CancelResult> withdraw() {
        log.info("api withdraw all bot orders");
        return ResponseEntity.ok(botService.withdrawAll());
    }
}
