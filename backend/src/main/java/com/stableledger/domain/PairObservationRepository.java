package com.stableledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for pair_observations, keyed by pair id.
 */
public interface PairObservationRepository extends MongoRepository<PairObservation, String> {
}
