package com.prediction.market.exchange.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.stereotype.Repository;

import com.prediction.market.exchange.entity.Order;
import com.prediction.market.exchange.entity.Side;

/**
 * Orders are never deleted; queries filter on the active statuses instead.
 */
@Repository
public interface OrderRepository extends MongoRepository<Order, String> {

    /**
     * Resting orders on one side of a book, best price first, then oldest.
     */
    @Query(value = "{ 'marketId': ?0, 'side': ?1, 'status': { $in: ['OPEN', 'PARTIAL'] } }",
        sort = "{ 'price': -1, 'createdAt': 1 }")
    List<Order> findActiveBookSide(String marketId, Side side);

    @Query(value = "{ 'marketId': ?0, 'status': { $in: ['OPEN', 'PARTIAL'] } }", sort = "{ 'createdAt': 1 }")
    List<Order> findActiveOrdersByMarketId(String marketId);

    @Query(value = "{ 'accountId': ?0, 'status': { $in: ['OPEN', 'PARTIAL'] } }", sort = "{ 'createdAt': 1 }")
    List<Order> findActiveOrdersByAccountId(String accountId);

    @Query("{ 'status': { $in: ['OPEN', 'PARTIAL'] } }")
    List<Order> findAllActive();
}
