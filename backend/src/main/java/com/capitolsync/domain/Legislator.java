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
 * Member of Congress keyed by bioguide id.
 */
@Document(collection = "legislators")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Legislator {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String firstName;
    private String lastName;
    private String middleName;
    private String fullName;
    private Party party;
    private Chamber chamber;
    /** Two-letter state code; XX when unknown. */
    @Indexed
    private String state;
    private Integer district;
    private boolean inOffice;
    private DataSource dataSource;
    private Instant lastSyncedAt;
}
