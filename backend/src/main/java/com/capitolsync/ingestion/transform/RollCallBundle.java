package com.capitolsync.ingestion.transform;

import com.capitolsync.domain.RollCallVote;
import com.capitolsync.domain.VotePosition;

import java.util.List;

/**
 * A roll call together with the member positions recorded on it.
 */
public record RollCallBundle(RollCallVote rollCall, List<VotePosition> positions) {
}
