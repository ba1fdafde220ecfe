package com.capitolsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Recorded floor vote. Id format: {@code h<congress>-<session>-<roll>}.
 */
@Document(collection = "roll_call_votes")
@CompoundIndex(name = "congress_chamber_session_roll", def = "{'congress': 1, 'chamber': 1, 'session': 1, 'rollNumber': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class RollCallVote {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private int congress;
    private Chamber chamber;
    private int session;
    private int rollNumber;
    /** Bill voted on; null for procedural votes or when the bill was not imported. */
    private String billId;
    private VoteType voteType;
    private VoteCategory voteCategory;
    private String question;
    private VoteResult result;
    private int yeas;
    private int nays;
    private int present;
    private int notVoting;
    private Instant voteDate;
    private DataSource dataSource;
    private Instant lastSyncedAt;

    public enum VoteType {
        ROLL_CALL,
        VOICE,
        UNANIMOUS_CONSENT,
        DIVISION
    }

    public enum VoteCategory {
        PASSAGE,
        AMENDMENT,
        PROCEDURAL,
        CLOTURE,
        NOMINATION,
        TREATY,
        VETO_OVERRIDE,
        MOTION_TO_RECOMMIT,
        MOTION_TO_TABLE,
        IMPEACHMENT
    }

    public enum VoteResult {
        PASSED,
        FAILED,
        AGREED_TO,
        REJECTED
    }
}
