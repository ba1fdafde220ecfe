package com.capitolsync.ingestion.store;

import com.capitolsync.domain.Committee;
import com.capitolsync.domain.CommitteeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Upserts committees keyed by system code. A parent that is not stored yet is recorded as
 * {@code pendingParentId} and linked later by {@link #linkPendingParents()}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentCommitteeStore {

    private final CommitteeRepository repository;

    public UpsertResult upsert(Committee committee) {
        String parentId = committee.getParentId();
        if (parentId != null && !repository.existsById(parentId)) {
            committee.setParentId(null);
            committee.setPendingParentId(parentId);
        } else {
            committee.setPendingParentId(null);
        }
        return repository.findById(committee.getId())
                .map(existing -> {
                    repository.save(copyInto(existing, committee));
                    return UpsertResult.UPDATED;
                })
                .orElseGet(() -> {
                    repository.save(committee);
                    return UpsertResult.CREATED;
                });
    }

    /**
     * Second pass: link committees whose parent has since been stored.
     *
     * @return number of committees linked
     */
    public int linkPendingParents() {
        List<Committee> pending = repository.findByPendingParentIdIsNotNull();
        int linked = 0;
        for (Committee committee : pending) {
            if (repository.existsById(committee.getPendingParentId())) {
                committee.setParentId(committee.getPendingParentId());
                committee.setPendingParentId(null);
                repository.save(committee);
                linked++;
            } else {
                log.warn("Committee {} references missing parent {}", committee.getId(), committee.getPendingParentId());
            }
        }
        return linked;
    }

    private static Committee copyInto(Committee target, Committee source) {
        target.setName(source.getName());
        target.setChamber(source.getChamber());
        target.setType(source.getType());
        target.setParentId(source.getParentId());
        target.setPendingParentId(source.getPendingParentId());
        target.setDataSource(source.getDataSource());
        target.setLastSyncedAt(source.getLastSyncedAt());
        return target;
    }
}
