package com.capitolsync.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * One legislator's position on one roll call. Id format: {@code <rollCallId>:<legislatorId>}.
 */
@Document(collection = "vote_positions")
@CompoundIndex(name = "rollcall_legislator", def = "{'rollCallId': 1, 'legislatorId': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class VotePosition {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String rollCallId;
    private String legislatorId;
    private Position position;
    private boolean proxy;
    private String pairedWithId;

    public static String idFor(String rollCallId, String legislatorId) {
        return rollCallId + ":" + legislatorId;
    }

    public enum Position {
        YEA,
        NAY,
        PRESENT,
        NOT_VOTING
    }
}
