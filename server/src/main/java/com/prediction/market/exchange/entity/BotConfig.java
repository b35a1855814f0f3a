package com.prediction.market.exchange.entity;

import java.math.BigDecimal;

import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Liquidity bot settings. Loaded once per unit of work and handed to the
 * risk and liquidity components as an explicit argument.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "bot_config")
public class BotConfig {

    public static final String SINGLETON_ID = "default";

    @MongoId
    private String id;

    /**
     * Account whose short (NO) positions count as bot exposure.
     */
    private String botAccountId;

    /**
     * Ceiling on the bot's worst-case payout.
     */
    private long maxLoss;

    /**
     * Total payout capacity spread over all markets before multipliers.
     */
    private long totalLiquidity;

    /**
     * Width of one risk tier, in percent of maxLoss.
     */
    private int tierWidthPercent;

    private BigDecimal globalMultiplier;

    /**
     * Smallest order (in shares) the bot keeps resting.
     */
    private int minOrderShares;

    private boolean active;

    private long updatedAt;

    public BotConfig copy() {
        return toBuilder().build();
    }
}
