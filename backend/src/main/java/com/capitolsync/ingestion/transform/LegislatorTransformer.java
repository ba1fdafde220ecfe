package com.capitolsync.ingestion.transform;

import com.capitolsync.domain.Chamber;
import com.capitolsync.domain.DataSource;
import com.capitolsync.domain.Legislator;
import com.capitolsync.ingestion.client.model.MemberListItem;
import com.capitolsync.ingestion.client.model.MemberTerm;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Arrays;

/**
 * Maps a member list entry to a {@link Legislator}. Chamber, state and district come from the latest term.
 */
@Component
public class LegislatorTransformer {

    private final Clock clock;

    public LegislatorTransformer() {
        this(Clock.systemUTC());
    }

    LegislatorTransformer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param currentMember whether the entry came from the current-member listing
     * @throws TransformException when the bioguide id or name is missing
     */
    public Legislator transform(MemberListItem item, boolean currentMember) {
        if (item.bioguideId() == null || item.bioguideId().isBlank()) {
            throw new TransformException("Member without bioguideId");
        }
        if (item.name() == null || item.name().isBlank()) {
            throw new TransformException("Member " + item.bioguideId() + " without name");
        }
        ParsedName name = parseFullName(item.name());
        MemberTerm term = item.latestTerm();

        Legislator legislator = new Legislator();
        legislator.setId(item.bioguideId());
        legislator.setFirstName(name.firstName());
        legislator.setLastName(name.lastName());
        legislator.setMiddleName(name.middleName());
        legislator.setFullName(item.name().trim());
        legislator.setParty(CongressMappings.party(item.partyName()));
        Chamber chamber = term != null ? CongressMappings.chamber(term.chamber()) : null;
        legislator.setChamber(chamber != null ? chamber : Chamber.HOUSE);
        legislator.setState(term != null && term.stateCode() != null
                ? term.stateCode()
                : CongressMappings.stateCode(item.state()));
        legislator.setDistrict(item.district() != null ? item.district() : term != null ? term.district() : null);
        legislator.setInOffice(currentMember);
        legislator.setDataSource(DataSource.CONGRESS_GOV);
        legislator.setLastSyncedAt(Instant.now(clock));
        return legislator;
    }

    /**
     * Splits "Last, First Middle" or "First Middle Last". A single token is taken as the last name.
     */
    static ParsedName parseFullName(String fullName) {
        String trimmed = fullName.trim();
        int comma = trimmed.indexOf(',');
        if (comma >= 0) {
            String last = trimmed.substring(0, comma).trim();
            String[] rest = trimmed.substring(comma + 1).trim().split("\\s+");
            String first = rest.length > 0 ? rest[0] : "";
            String middle = rest.length > 1 ? String.join(" ", Arrays.copyOfRange(rest, 1, rest.length)) : null;
            return new ParsedName(first, last, middle);
        }
        String[] parts = trimmed.split("\\s+");
        if (parts.length == 1) {
            return new ParsedName("", parts[0], null);
        }
        if (parts.length == 2) {
            return new ParsedName(parts[0], parts[1], null);
        }
        String middle = String.join(" ", Arrays.copyOfRange(parts, 1, parts.length - 1));
        return new ParsedName(parts[0], parts[parts.length - 1], middle);
    }

    record ParsedName(String firstName, String lastName, String middleName) {
    }
}
