package com.prediction.market.exchange.repositories;

import java.util.List;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import com.prediction.market.exchange.entity.Position;
import com.prediction.market.exchange.entity.PositionStatus;

@Repository
public interface PositionRepository extends MongoRepository<Position, String> {

    List<Position> findByMarketIdAndStatusOrderByCreatedAtAsc(String marketId, PositionStatus status);

    /**
     * Active positions in a market where the account holds either side, oldest first.
     */
    @Query(value = "{ 'marketId': ?1, 'status': 'ACTIVE', $or: [ { 'yesAccountId': ?0 }, { 'noAccountId': ?0 } ] }",
        sort = "{ 'createdAt': 1 }")
    List<Position> findActiveForAccountInMarket(String accountId, String marketId);

    @Query(value = "{ 'status': 'ACTIVE', $or: [ { 'yesAccountId': ?0 }, { 'noAccountId': ?0 } ] }",
        sort = "{ 'createdAt': 1 }")
    List<Position> findActiveForAccount(String accountId);

    List<Position> findByNoAccountIdAndStatus(String noAccountId, PositionStatus status);

    List<Position> findByStatus(PositionStatus status);

    List<Position> findByMarketIdOrderByCreatedAtDesc(String marketId, Pageable pageable);
}
