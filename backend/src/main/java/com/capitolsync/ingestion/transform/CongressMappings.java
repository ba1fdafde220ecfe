package com.capitolsync.ingestion.transform;

import com.capitolsync.domain.Bill;
import com.capitolsync.domain.Chamber;
import com.capitolsync.domain.Committee;
import com.capitolsync.domain.Party;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Lookup tables shared by the transformers: party, chamber, state, committee type, bill type and dates.
 */
public final class CongressMappings {

    /** State code used when a member's state cannot be resolved. */
    public static final String UNKNOWN_STATE = "XX";

    private static final Map<String, Party> PARTIES = Map.ofEntries(
            Map.entry("democratic", Party.D),
            Map.entry("democrat", Party.D),
            Map.entry("d", Party.D),
            Map.entry("republican", Party.R),
            Map.entry("r", Party.R),
            Map.entry("independent", Party.I),
            Map.entry("i", Party.I),
            Map.entry("libertarian", Party.L),
            Map.entry("l", Party.L),
            Map.entry("green", Party.G),
            Map.entry("g", Party.G));

    private static final Map<String, Chamber> CHAMBERS = Map.of(
            "house", Chamber.HOUSE,
            "h", Chamber.HOUSE,
            "house of representatives", Chamber.HOUSE,
            "senate", Chamber.SENATE,
            "s", Chamber.SENATE);

    private static final Map<String, String> STATE_NAMES = new LinkedHashMap<>();
    private static final Map<String, String> STATE_CODES_BY_NAME = new HashMap<>();

    static {
        String[][] states = {
                {"AL", "Alabama"}, {"AK", "Alaska"}, {"AZ", "Arizona"}, {"AR", "Arkansas"}, {"CA", "California"},
                {"CO", "Colorado"}, {"CT", "Connecticut"}, {"DE", "Delaware"}, {"FL", "Florida"}, {"GA", "Georgia"},
                {"HI", "Hawaii"}, {"ID", "Idaho"}, {"IL", "Illinois"}, {"IN", "Indiana"}, {"IA", "Iowa"},
                {"KS", "Kansas"}, {"KY", "Kentucky"}, {"LA", "Louisiana"}, {"ME", "Maine"}, {"MD", "Maryland"},
                {"MA", "Massachusetts"}, {"MI", "Michigan"}, {"MN", "Minnesota"}, {"MS", "Mississippi"},
                {"MO", "Missouri"}, {"MT", "Montana"}, {"NE", "Nebraska"}, {"NV", "Nevada"}, {"NH", "New Hampshire"},
                {"NJ", "New Jersey"}, {"NM", "New Mexico"}, {"NY", "New York"}, {"NC", "North Carolina"},
                {"ND", "North Dakota"}, {"OH", "Ohio"}, {"OK", "Oklahoma"}, {"OR", "Oregon"}, {"PA", "Pennsylvania"},
                {"RI", "Rhode Island"}, {"SC", "South Carolina"}, {"SD", "South Dakota"}, {"TN", "Tennessee"},
                {"TX", "Texas"}, {"UT", "Utah"}, {"VT", "Vermont"}, {"VA", "Virginia"}, {"WA", "Washington"},
                {"WV", "West Virginia"}, {"WI", "Wisconsin"}, {"WY", "Wyoming"}, {"DC", "District of Columbia"},
                {"PR", "Puerto Rico"}, {"VI", "Virgin Islands"}, {"GU", "Guam"}, {"AS", "American Samoa"},
                {"MP", "Northern Mariana Islands"}
        };
        for (String[] state : states) {
            STATE_NAMES.put(state[0], state[1]);
            STATE_CODES_BY_NAME.put(state[1].toLowerCase(Locale.ROOT), state[0]);
        }
    }

    private CongressMappings() {
    }

    /** Unknown or missing party names map to {@link Party#O}. */
    public static Party party(String partyName) {
        if (partyName == null) {
            return Party.O;
        }
        return PARTIES.getOrDefault(partyName.trim().toLowerCase(Locale.ROOT), Party.O);
    }

    /** Null when the chamber is missing or not House/Senate (e.g. joint committees). */
    public static Chamber chamber(String chamber) {
        if (chamber == null) {
            return null;
        }
        return CHAMBERS.get(chamber.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Two-letter code for a state given as a code or a full name; {@link #UNKNOWN_STATE} otherwise.
     */
    public static String stateCode(String state) {
        if (state == null || state.isBlank()) {
            return UNKNOWN_STATE;
        }
        String trimmed = state.trim();
        if (trimmed.length() == 2 && STATE_NAMES.containsKey(trimmed.toUpperCase(Locale.ROOT))) {
            return trimmed.toUpperCase(Locale.ROOT);
        }
        return STATE_CODES_BY_NAME.getOrDefault(trimmed.toLowerCase(Locale.ROOT), UNKNOWN_STATE);
    }

    public static Committee.CommitteeType committeeType(String typeCode) {
        if (typeCode == null) {
            return Committee.CommitteeType.STANDING;
        }
        return switch (typeCode.trim().toLowerCase(Locale.ROOT)) {
            case "select" -> Committee.CommitteeType.SELECT;
            case "joint" -> Committee.CommitteeType.JOINT;
            case "subcommittee" -> Committee.CommitteeType.SUBCOMMITTEE;
            case "special" -> Committee.CommitteeType.SPECIAL;
            default -> Committee.CommitteeType.STANDING;
        };
    }

    /**
     * @throws TransformException for a type outside the eight Congress.gov bill types
     */
    public static Bill.BillType billType(String type) {
        if (type == null) {
            throw new TransformException("Missing bill type");
        }
        try {
            return Bill.BillType.valueOf(type.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TransformException("Unknown bill type: " + type, e);
        }
    }

    /** Accepts {@code 2024-01-15} and ISO date-times; null when missing or unparseable. */
    public static LocalDate date(String value) {
        if (value == null || value.length() < 10) {
            return null;
        }
        try {
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** ISO date-time with offset, or a plain date taken as UTC midnight; null when unparseable. */
    public static Instant instant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            LocalDate date = date(value);
            return date != null ? date.atStartOfDay().toInstant(ZoneOffset.UTC) : null;
        }
    }

    public static int parseNumber(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new TransformException("Missing " + field);
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new TransformException("Invalid " + field + ": " + value, e);
        }
    }
}
