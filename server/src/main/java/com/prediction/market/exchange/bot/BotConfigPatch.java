package com.prediction.market.exchange.bot;

import java.math.BigDecimal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Partial bot configuration update. Null fields keep their current value.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BotConfigPatch {
    private Long maxLoss;
    private Long totalLiquidity;
    private Integer tierWidthPercent;
    private BigDecimal globalMultiplier;
    private Integer minOrderShares;
    private Boolean active;
}
