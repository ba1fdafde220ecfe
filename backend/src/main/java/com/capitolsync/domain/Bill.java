package com.capitolsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Bill or resolution. Id format: {@code <type>-<number>-<congress>}, e.g. {@code hr-1234-118}.
 */
@Document(collection = "bills")
@CompoundIndex(name = "congress_type_number", def = "{'congress': 1, 'billType': 1, 'billNumber': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Bill {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private int congress;
    private BillType billType;
    private int billNumber;
    private String title;
    private BillStatus status;
    private Chamber originChamber;
    /** Upstream list items carry no introduction date; the update date is used until details are fetched. */
    private LocalDate introducedDate;
    private LocalDate lastActionDate;
    private String latestActionText;
    private DataSource dataSource;
    private Instant lastSyncedAt;

    public enum BillType {
        HR,
        S,
        HJRES,
        SJRES,
        HCONRES,
        SCONRES,
        HRES,
        SRES
    }

    public enum BillStatus {
        INTRODUCED,
        IN_COMMITTEE,
        REPORTED_BY_COMMITTEE,
        PASSED_HOUSE,
        PASSED_SENATE,
        RESOLVING_DIFFERENCES,
        TO_PRESIDENT,
        SIGNED_INTO_LAW,
        ENACTED,
        VETOED,
        VETO_OVERRIDDEN,
        POCKET_VETOED,
        FAILED,
        WITHDRAWN
    }
}
