package com.capitolsync.ingestion.store;

import com.capitolsync.domain.Bill;
import com.capitolsync.domain.BillRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Upserts bills keyed by {@code <type>-<number>-<congress>}.
 */
@Service
@RequiredArgsConstructor
public class IdempotentBillStore {

    private final BillRepository repository;

    public UpsertResult upsert(Bill bill) {
        return repository.findById(bill.getId())
                .map(existing -> {
                    repository.save(copyInto(existing, bill));
                    return UpsertResult.UPDATED;
                })
                .orElseGet(() -> {
                    repository.save(bill);
                    return UpsertResult.CREATED;
                });
    }

    /**
     * Introduction date is kept once set, since list entries only carry the update date as a stand-in.
     */
    private static Bill copyInto(Bill target, Bill source) {
        target.setTitle(source.getTitle());
        target.setStatus(source.getStatus());
        target.setOriginChamber(source.getOriginChamber());
        target.setLastActionDate(source.getLastActionDate());
        target.setLatestActionText(source.getLatestActionText());
        if (target.getIntroducedDate() == null) {
            target.setIntroducedDate(source.getIntroducedDate());
        }
        target.setDataSource(source.getDataSource());
        target.setLastSyncedAt(source.getLastSyncedAt());
        return target;
    }
}
