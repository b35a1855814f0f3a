package com.prediction.market.exchange.risk;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExposureView {
    long totalAtRisk;
    int tier;
    Long lastPullbackAt;
}
