package com.capitolsync.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Implementation of VotePositionRepositoryCustom using MongoTemplate.findDistinct.
 */
@Repository
@RequiredArgsConstructor
public class VotePositionRepositoryImpl implements VotePositionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<String> findDistinctLegislatorIds() {
        return mongoTemplate.findDistinct(new Query(), "legislatorId", VotePosition.class, String.class);
    }

    @Override
    public List<String> findDistinctRollCallIds() {
        return mongoTemplate.findDistinct(new Query(), "rollCallId", VotePosition.class, String.class);
    }
}
