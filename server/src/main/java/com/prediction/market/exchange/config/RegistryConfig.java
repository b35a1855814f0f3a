package com.prediction.market.exchange.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.prediction.market.exchange.execution.MarketExecutionRegistry;

@Configuration
public class RegistryConfig {

    @Bean
    public MarketExecutionRegistry marketExecutionRegistry() {
        return new MarketExecutionRegistry();
    }
}
