package com.prediction.market.exchange.web;

import com.prediction.market.exchange.entity.Side;

import jakarta.validation.constraints.NotBlank;
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
public class PlaceOrderRequest {

    @NotBlank
    private String marketId;

    @NotNull
    private Side side;

    /**
     * Per-share cost in units of 1/1000 of the payout.
     */
    @NotNull
    private Integer price;

    @NotNull
    private Integer shares;
}
