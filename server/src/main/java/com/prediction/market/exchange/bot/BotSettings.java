package com.prediction.market.exchange.bot;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import com.prediction.market.exchange.entity.Account;
import com.prediction.market.exchange.entity.BotAction;
import com.prediction.market.exchange.entity.BotConfig;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.ledger.LedgerClock;
import com.prediction.market.exchange.ledger.LedgerSession;

import lombok.extern.slf4j.Slf4j;

/**
 * The persisted bot configuration. The first read seeds it, and the bot's
 * account, from the configured defaults.
 */
@Slf4j
public class BotSettings {

    private final BotConfig defaults;
    private final LedgerClock clock;

    public BotSettings(BotConfig defaults, LedgerClock clock) {
        this.defaults = defaults;
        this.clock = clock;
    }

    public BotConfig load(LedgerSession session) {
        return session.findBotConfig().orElseGet(() -> seed(session));
    }

    /**
     * The stored configuration, or the unsaved defaults if nothing is stored yet.
     */
    public BotConfig current(LedgerSession session) {
        return session.findBotConfig().orElseGet(() -> {
            BotConfig config = defaults.toBuilder().id(BotConfig.SINGLETON_ID).build();
            validate(config);
            return config;
        });
    }

    private BotConfig seed(LedgerSession session) {
        long now = clock.tick();
        BotConfig config = defaults.toBuilder()
            .id(BotConfig.SINGLETON_ID)
            .updatedAt(now)
            .build();
        validate(config);
        session.saveBotConfig(config);
        if (session.findAccount(config.getBotAccountId()).isEmpty()) {
            session.saveAccount(Account.builder()
                .id(config.getBotAccountId())
                .balance(0)
                .createdAt(now)
                .updatedAt(now)
                .build());
        }
        log.info("Bot config seeded: botAccountId={}, maxLoss={}, totalLiquidity={}, active={}",
            config.getBotAccountId(), config.getMaxLoss(), config.getTotalLiquidity(), config.isActive());
        return config;
    }

    public BotConfig update(LedgerSession session, BotConfigPatch patch) {
        BotConfig config = load(session);
        BotConfig updated = config.toBuilder()
            .maxLoss(patch.getMaxLoss() != null ? patch.getMaxLoss() : config.getMaxLoss())
            .totalLiquidity(patch.getTotalLiquidity() != null ? patch.getTotalLiquidity() : config.getTotalLiquidity())
            .tierWidthPercent(patch.getTierWidthPercent() != null
                ? patch.getTierWidthPercent() : config.getTierWidthPercent())
            .globalMultiplier(patch.getGlobalMultiplier() != null
                ? patch.getGlobalMultiplier() : config.getGlobalMultiplier())
            .minOrderShares(patch.getMinOrderShares() != null ? patch.getMinOrderShares() : config.getMinOrderShares())
            .active(patch.getActive() != null ? patch.getActive() : config.isActive())
            .updatedAt(clock.tick())
            .build();
        validate(updated);
        session.saveBotConfig(updated);

        BotActivity.record(session, BotAction.CONFIG_UPDATED, describe(updated), null, null, updated.getUpdatedAt());
        log.info("Bot config updated: {}", describe(updated));
        return updated;
    }

    private static void validate(BotConfig config) {
        List<String> errors = new ArrayList<>();
        if (config.getBotAccountId() == null || config.getBotAccountId().isBlank()) {
            errors.add("botAccountId is required");
        }
        if (config.getMaxLoss() <= 0) {
            errors.add("maxLoss must be positive");
        }
        if (config.getTotalLiquidity() < 0) {
            errors.add("totalLiquidity must not be negative");
        }
        if (config.getTierWidthPercent() < 1 || config.getTierWidthPercent() > 100) {
            errors.add("tierWidthPercent must be between 1 and 100");
        }
        if (config.getGlobalMultiplier() == null || config.getGlobalMultiplier().compareTo(BigDecimal.ZERO) < 0) {
            errors.add("globalMultiplier must be non-negative");
        }
        if (config.getMinOrderShares() < 1) {
            errors.add("minOrderShares must be at least 1");
        }
        if (config.getGlobalMultiplier() != null && config.getMaxLoss() > 0
                && BigDecimal.valueOf(config.getTotalLiquidity()).multiply(config.getGlobalMultiplier())
                    .compareTo(BigDecimal.valueOf(config.getMaxLoss())) > 0) {
            // a full sweep of one deployment must stay within maxLoss
            errors.add("totalLiquidity x globalMultiplier must not exceed maxLoss");
        }
        if (!errors.isEmpty()) {
            throw new InvalidArgumentException(errors);
        }
    }

    private static String describe(BotConfig config) {
        return String.format("maxLoss=%d, totalLiquidity=%d, tierWidthPercent=%d, globalMultiplier=%s, "
                + "minOrderShares=%d, active=%s",
            config.getMaxLoss(), config.getTotalLiquidity(), config.getTierWidthPercent(),
            config.getGlobalMultiplier().toPlainString(), config.getMinOrderShares(), config.isActive());
    }
}
