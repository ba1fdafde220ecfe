package com.capitolsync.domain;

import java.util.List;

/**
 * Custom repository methods using MongoTemplate (findDistinct) for referential checks.
 */
public interface VotePositionRepositoryCustom {

    /** Distinct legislator ids referenced by any vote position. */
    List<String> findDistinctLegislatorIds();

    /** Distinct roll call ids referenced by any vote position. */
    List<String> findDistinctRollCallIds();
}
