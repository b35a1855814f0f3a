package com.prediction.market.exchange.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.exchange.entity.Market;
import com.prediction.market.exchange.entity.MarketStatus;

@Repository
public interface MarketRepository extends MongoRepository<Market, String> {

    List<Market> findByStatusOrderByCreatedAtAsc(MarketStatus status);
}
