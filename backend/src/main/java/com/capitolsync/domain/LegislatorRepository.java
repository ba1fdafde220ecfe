package com.capitolsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface LegislatorRepository extends MongoRepository<Legislator, String> {

    /** Data quality check: legislators whose state could not be resolved. */
    long countByState(String state);

    long countByChamberAndInOfficeTrue(Chamber chamber);

    long countByPartyAndInOfficeTrue(Party party);

    long countByLastSyncedAtIsNotNull();
}
