package com.capitolsync.ingestion.store;

import com.capitolsync.domain.Legislator;
import com.capitolsync.domain.LegislatorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Upserts legislators keyed by bioguide id. Re-applying the same record only rewrites the same values.
 */
@Service
@RequiredArgsConstructor
public class IdempotentLegislatorStore {

    private final LegislatorRepository repository;

    public UpsertResult upsert(Legislator legislator) {
        return repository.findById(legislator.getId())
                .map(existing -> {
                    repository.save(copyInto(existing, legislator));
                    return UpsertResult.UPDATED;
                })
                .orElseGet(() -> {
                    repository.save(legislator);
                    return UpsertResult.CREATED;
                });
    }

    private static Legislator copyInto(Legislator target, Legislator source) {
        target.setFirstName(source.getFirstName());
        target.setLastName(source.getLastName());
        target.setMiddleName(source.getMiddleName());
        target.setFullName(source.getFullName());
        target.setParty(source.getParty());
        target.setChamber(source.getChamber());
        target.setState(source.getState());
        target.setDistrict(source.getDistrict());
        target.setInOffice(source.isInOffice());
        target.setDataSource(source.getDataSource());
        target.setLastSyncedAt(source.getLastSyncedAt());
        return target;
    }
}
