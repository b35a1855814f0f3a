package com.prediction.market.exchange.repositories;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.exchange.entity.BotActionLog;

@Repository
public interface BotActionLogRepository extends MongoRepository<BotActionLog, String> {

    List<BotActionLog> findAllByOrderByTimestampDesc(Pageable pageable);
}
