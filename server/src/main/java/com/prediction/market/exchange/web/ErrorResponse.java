package com.prediction.market.exchange.web;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    int status;
    String error;
    String message;
    List<String> errors;
    Long required;
    Long available;
}
