package com.capitolsync.ingestion.store;

import com.capitolsync.domain.BillRepository;
import com.capitolsync.domain.Legislator;
import com.capitolsync.domain.LegislatorRepository;
import com.capitolsync.domain.RollCallVote;
import com.capitolsync.domain.RollCallVoteRepository;
import com.capitolsync.domain.VotePosition;
import com.capitolsync.domain.VotePositionRepository;
import com.capitolsync.ingestion.transform.RollCallBundle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Upserts roll calls and their vote positions. A bill reference to a bill that was not imported is dropped;
 * a position of a legislator that was not imported is skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentRollCallStore {

    private final RollCallVoteRepository rollCallRepository;
    private final VotePositionRepository positionRepository;
    private final BillRepository billRepository;
    private final LegislatorRepository legislatorRepository;

    public RollCallOutcome upsert(RollCallBundle bundle) {
        UpsertResult rollCall = upsertRollCall(bundle.rollCall());
        PositionCounts positions = upsertPositions(bundle.positions());
        return new RollCallOutcome(rollCall, positions);
    }

    UpsertResult upsertRollCall(RollCallVote vote) {
        if (vote.getBillId() != null && !billRepository.existsById(vote.getBillId())) {
            log.debug("Roll call {} references bill {} which is not imported", vote.getId(), vote.getBillId());
            vote.setBillId(null);
        }
        return rollCallRepository.findById(vote.getId())
                .map(existing -> {
                    rollCallRepository.save(copyInto(existing, vote));
                    return UpsertResult.UPDATED;
                })
                .orElseGet(() -> {
                    rollCallRepository.save(vote);
                    return UpsertResult.CREATED;
                });
    }

    PositionCounts upsertPositions(List<VotePosition> positions) {
        if (positions.isEmpty()) {
            return PositionCounts.NONE;
        }
        Set<String> legislatorIds = positions.stream().map(VotePosition::getLegislatorId).collect(Collectors.toSet());
        Set<String> knownLegislators = new HashSet<>();
        for (Legislator legislator : legislatorRepository.findAllById(legislatorIds)) {
            knownLegislators.add(legislator.getId());
        }
        Map<String, VotePosition> existing = positionRepository.findAllById(
                        positions.stream().map(VotePosition::getId).toList())
                .stream()
                .collect(Collectors.toMap(VotePosition::getId, Function.identity()));

        int created = 0;
        int updated = 0;
        int skipped = 0;
        List<VotePosition> toSave = new ArrayList<>();
        for (VotePosition position : positions) {
            if (!knownLegislators.contains(position.getLegislatorId())) {
                skipped++;
                continue;
            }
            VotePosition current = existing.get(position.getId());
            if (current != null) {
                current.setPosition(position.getPosition());
                current.setProxy(position.isProxy());
                current.setPairedWithId(position.getPairedWithId());
                toSave.add(current);
                updated++;
            } else {
                toSave.add(position);
                created++;
            }
        }
        positionRepository.saveAll(toSave);
        return new PositionCounts(created, updated, skipped);
    }

    private static RollCallVote copyInto(RollCallVote target, RollCallVote source) {
        target.setBillId(source.getBillId());
        target.setVoteType(source.getVoteType());
        target.setVoteCategory(source.getVoteCategory());
        target.setQuestion(source.getQuestion());
        target.setResult(source.getResult());
        target.setYeas(source.getYeas());
        target.setNays(source.getNays());
        target.setPresent(source.getPresent());
        target.setNotVoting(source.getNotVoting());
        target.setVoteDate(source.getVoteDate());
        target.setDataSource(source.getDataSource());
        target.setLastSyncedAt(source.getLastSyncedAt());
        return target;
    }

    /** Roll call outcome plus the position counts written with it. */
    public record RollCallOutcome(UpsertResult rollCall, PositionCounts positions) {
    }

    public record PositionCounts(int created, int updated, int skipped) {

        public static final PositionCounts NONE = new PositionCounts(0, 0, 0);

        public PositionCounts plus(PositionCounts other) {
            return new PositionCounts(created + other.created, updated + other.updated, skipped + other.skipped);
        }

        public int total() {
            return created + updated;
        }
    }
}
