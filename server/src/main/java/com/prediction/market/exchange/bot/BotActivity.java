package com.prediction.market.exchange.bot;

import java.util.UUID;

import com.prediction.market.exchange.entity.BotAction;
import com.prediction.market.exchange.entity.BotActionLog;
import com.prediction.market.exchange.ledger.LedgerSession;

final class BotActivity {

    private BotActivity() {
    }

    static void record(LedgerSession session, BotAction action, String details, Long exposureBefore,
            Long exposureAfter, long timestamp) {
        session.appendBotAction(BotActionLog.builder()
            .id(UUID.randomUUID().toString())
            .action(action)
            .details(details)
            .exposureBefore(exposureBefore)
            .exposureAfter(exposureAfter)
            .timestamp(timestamp)
            .build());
    }
}
