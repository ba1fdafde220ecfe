package com.capitolsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface RollCallVoteRepository extends MongoRepository<RollCallVote, String> {

    long countByCongress(int congress);
}
