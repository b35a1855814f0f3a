package com.prediction.market.exchange.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.exchange.entity.MarketWeight;

@Repository
public interface MarketWeightRepository extends MongoRepository<MarketWeight, String> {
}
