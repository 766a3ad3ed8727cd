package com.stableledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for collateral_positions. Only CollateralEngine writes.
 */
public interface CollateralPositionRepository extends MongoRepository<CollateralPosition, String> {
}
