package com.prediction.market.exchange.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * One rung of a normalized curve: a YES-probability price point (percent)
 * and the share of the budget it receives.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class CurvePoint {
    private int price;
    private double weight;
}
