package com.prediction.market.exchange.repositories;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.exchange.entity.ResolutionAction;
import com.prediction.market.exchange.entity.ResolutionLog;

@Repository
public interface ResolutionLogRepository extends MongoRepository<ResolutionLog, String> {

    Optional<ResolutionLog> findFirstByMarketIdAndActionOrderByTimestampDesc(String marketId, ResolutionAction action);
}
