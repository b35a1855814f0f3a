package com.prediction.market.exchange.web;

import com.prediction.market.exchange.entity.Side;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ResolveMarketRequest {

    @NotNull
    private Side outcome;

    private String notes;
}
