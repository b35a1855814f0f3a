package com.prediction.market.exchange;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PredictionExchangeApplication {

	public static void main(String[] args) {
		SpringApplication.run(PredictionExchangeApplication.class, args);
	}

}
