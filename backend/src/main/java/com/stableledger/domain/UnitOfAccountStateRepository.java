package com.stableledger.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

/**
 * Persistence for the single unit_of_account document.
 */
public interface UnitOfAccountStateRepository extends MongoRepository<UnitOfAccountState, String> {
}
