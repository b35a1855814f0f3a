package com.prediction.market.exchange.engine;

import java.util.List;

import com.prediction.market.exchange.entity.Order;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CancelResult {
    List<Order> orders;
    long refunded;
}
