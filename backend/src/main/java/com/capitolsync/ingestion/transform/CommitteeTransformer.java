package com.capitolsync.ingestion.transform;

import com.capitolsync.domain.Chamber;
import com.capitolsync.domain.Committee;
import com.capitolsync.domain.DataSource;
import com.capitolsync.ingestion.client.model.CommitteeListItem;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * Maps committee list entries to {@link Committee}s; the parent system code becomes {@code parentId}.
 */
@Component
public class CommitteeTransformer {

    /** Top-level committees first; relative order is otherwise preserved (stable sort). */
    public static final Comparator<CommitteeListItem> PARENTS_FIRST =
            Comparator.comparing(CommitteeListItem::hasParent);

    public Committee transform(CommitteeListItem item) {
        if (item.systemCode() == null || item.systemCode().isBlank()) {
            throw new TransformException("Committee without systemCode");
        }
        if (item.name() == null || item.name().isBlank()) {
            throw new TransformException("Committee " + item.systemCode() + " without name");
        }
        Committee committee = new Committee();
        committee.setId(item.systemCode());
        committee.setName(item.name());
        Chamber chamber = CongressMappings.chamber(item.chamber());
        committee.setChamber(chamber != null ? chamber : Chamber.HOUSE);
        committee.setType(CongressMappings.committeeType(item.committeeTypeCode()));
        committee.setParentId(item.hasParent() ? item.parent().systemCode() : null);
        committee.setDataSource(DataSource.CONGRESS_GOV);
        committee.setLastSyncedAt(Instant.now());
        return committee;
    }

    /** Sorts a fetched committee list so that parents are upserted before their subcommittees. */
    public static List<CommitteeListItem> parentsFirst(List<CommitteeListItem> items) {
        return items.stream().sorted(PARENTS_FIRST).toList();
    }
}
