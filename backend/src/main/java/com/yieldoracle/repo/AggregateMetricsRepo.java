package com.yieldoracle.repo;

import com.yieldoracle.model.AggregateMetrics;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface AggregateMetricsRepo extends MongoRepository<AggregateMetrics, String> {

    Optional<AggregateMetrics> findTopByOrderByTsDesc();
}
