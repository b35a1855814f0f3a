package com.prediction.market.exchange.entity;

public enum BotAction {
    CONFIG_UPDATED,
    DEPLOY_MARKET,
    DEPLOY_ALL,
    WITHDRAW_ALL,
    PULLBACK
}
