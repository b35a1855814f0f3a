package com.prediction.market.exchange.repositories;

import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.exchange.entity.CurveShape;

@Repository
public interface CurveShapeRepository extends MongoRepository<CurveShape, String> {

    Optional<CurveShape> findFirstByDefaultShapeTrue();

    List<CurveShape> findAllByOrderByCreatedAtAsc();
}
