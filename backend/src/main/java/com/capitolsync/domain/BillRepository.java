package com.capitolsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface BillRepository extends MongoRepository<Bill, String> {

    long countByCongress(int congress);

    /** Data quality check: bills imported without a title. */
    long countByTitleIsNullOrTitle(String title);

    long countByIntroducedDateIsNull();
}
