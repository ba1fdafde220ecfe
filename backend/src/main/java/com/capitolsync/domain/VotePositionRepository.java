package com.capitolsync.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface VotePositionRepository extends MongoRepository<VotePosition, String>, VotePositionRepositoryCustom {
}
