package com.capitolsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CommitteeRepository extends MongoRepository<Committee, String> {

    /** Committees whose parent link was deferred because the parent was not imported yet. */
    List<Committee> findByPendingParentIdIsNotNull();

    List<Committee> findByParentIdIsNotNull();
}
