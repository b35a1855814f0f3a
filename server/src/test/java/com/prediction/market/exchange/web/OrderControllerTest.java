package com.prediction.market.exchange.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.prediction.market.exchange.engine.CancelResult;
import com.prediction.market.exchange.entity.Side;
import com.prediction.market.exchange.error.ErrorKind;
import com.prediction.market.exchange.error.ForbiddenException;
import com.prediction.market.exchange.error.InsufficientFundsException;
import com.prediction.market.exchange.error.InvalidArgumentException;
import com.prediction.market.exchange.error.NotFoundException;
import com.prediction.market.exchange.service.TradingService;

class OrderControllerTest {

    private TradingService trading;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        trading = mock(TradingService.class);
        mvc = MockMvcBuilders.standaloneSetup(new OrderController(trading))
            .setControllerAdvice(new ExchangeExceptionHandler())
            .build();
    }

    @Test
    void insufficientFundsIsUnprocessableWithAmounts() throws Exception {
        when(trading.placeOrder(eq("alice"), eq("m1"), eq(Side.YES), anyInt(), anyInt()))
            .thenThrow(new InsufficientFundsException("alice", 7_000, 500));

        mvc.perform(post("/api/orders")
                .header(OrderController.ACCOUNT_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"marketId\":\"m1\",\"side\":\"YES\",\"price\":700,\"shares\":10}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.error").value("INSUFFICIENT_FUNDS"))
            .andExpect(jsonPath("$.required").value(7000))
            .andExpect(jsonPath("$.available").value(500));
    }

    @Test
    void invalidArgumentListsEveryError() throws Exception {
        when(trading.placeOrder(anyString(), anyString(), eq(Side.NO), anyInt(), anyInt()))
            .thenThrow(new InvalidArgumentException(List.of("Price must be between 1 and 999", "Shares must be at least 1")));

        mvc.perform(post("/api/orders")
                .header(OrderController.ACCOUNT_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"marketId\":\"m1\",\"side\":\"NO\",\"price\":0,\"shares\":0}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.errors.length()").value(2));
    }

    @Test
    void missingBodyFieldsAreRejectedBeforeTheService() throws Exception {
        mvc.perform(post("/api/orders")
                .header(OrderController.ACCOUNT_HEADER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"side\":\"YES\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));

        verifyNoInteractions(trading);
    }

    @Test
    void missingAccountHeaderIsBadRequest() throws Exception {
        mvc.perform(delete("/api/orders"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unknownOrderIsNotFound() throws Exception {
        when(trading.getOrder("o-1")).thenThrow(new NotFoundException("Order", "o-1"));

        mvc.perform(get("/api/orders/o-1"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.message").value("Order not found: o-1"));
    }

    @Test
    void cancellingSomeoneElsesOrderIsForbidden() throws Exception {
        when(trading.cancelOrder("bob", "o-1")).thenThrow(new ForbiddenException("Order o-1 belongs to another account"));

        mvc.perform(delete("/api/orders/o-1").header(OrderController.ACCOUNT_HEADER, "bob"))
            .andExpect(status().isForbidden());
    }

    @Test
    void cancelAllReturnsTheRefund() throws Exception {
        when(trading.cancelAllOrders("alice")).thenReturn(CancelResult.builder().orders(List.of()).refunded(1_200).build());

        mvc.perform(delete("/api/orders").header(OrderController.ACCOUNT_HEADER, "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.refunded").value(1200));
    }

    @Test
    void everyErrorKindHasAStatus() {
        assertThat(ExchangeExceptionHandler.statusOf(ErrorKind.INVALID_STATE)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ExchangeExceptionHandler.statusOf(ErrorKind.INVARIANT_VIOLATION))
            .isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        for (ErrorKind kind : ErrorKind.values()) {
            assertThat(ExchangeExceptionHandler.statusOf(kind)).isNotNull();
        }
    }
}
