package com.yieldoracle.repo;

import com.yieldoracle.model.YieldSample;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface YieldSampleRepo extends MongoRepository<YieldSample, String> {

    List<YieldSample> findByCycleIdOrderByProtocolIdAsc(String cycleId);

    List<YieldSample> findByProtocolIdAndTsGreaterThanEqualOrderByTsAsc(String protocolId, Instant since);

    Optional<YieldSample> findTopByProtocolIdOrderByTsDesc(String protocolId);

    long deleteByCycleId(String cycleId);
}
