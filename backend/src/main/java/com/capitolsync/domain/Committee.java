package com.capitolsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Committee or subcommittee keyed by its system code.
 */
@Document(collection = "committees")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Committee {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    private Chamber chamber;
    private CommitteeType type;
    /** Parent committee id; only set once the parent exists. */
    @Indexed
    private String parentId;
    /** Parent system code from upstream whose committee did not exist yet at upsert time. */
    @Indexed(sparse = true)
    private String pendingParentId;
    private DataSource dataSource;
    private Instant lastSyncedAt;

    public enum CommitteeType {
        STANDING,
        SELECT,
        JOINT,
        SUBCOMMITTEE,
        SPECIAL
    }
}
