package com.capitolsync.ingestion.transform;

import com.capitolsync.domain.Chamber;
import com.capitolsync.domain.DataSource;
import com.capitolsync.domain.RollCallVote;
import com.capitolsync.domain.VotePosition;
import com.capitolsync.ingestion.client.model.HouseVoteDetail;
import com.capitolsync.ingestion.client.model.HouseVoteMember;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a House roll call detail to a {@link RollCallVote} plus its {@link VotePosition}s.
 */
@Component
public class RollCallVoteTransformer {

    public RollCallBundle transform(HouseVoteDetail detail) {
        if (detail.congress() == null || detail.sessionNumber() == null || detail.rollCallNumber() == null) {
            throw new TransformException("Roll call without congress/session/number");
        }
        RollCallVote vote = new RollCallVote();
        vote.setId(rollCallId(Chamber.HOUSE, detail.congress(), detail.sessionNumber(), detail.rollCallNumber()));
        vote.setCongress(detail.congress());
        vote.setChamber(Chamber.HOUSE);
        vote.setSession(detail.sessionNumber());
        vote.setRollNumber(detail.rollCallNumber());
        vote.setBillId(billReference(detail.bill()));
        vote.setVoteType(voteType(detail.voteType()));
        vote.setVoteCategory(voteCategory(detail.category()));
        vote.setQuestion(firstNonBlank(detail.question(), detail.description(), "Unknown"));
        vote.setResult(voteResult(detail.result()));
        vote.setYeas(orZero(detail.totalYea()));
        vote.setNays(orZero(detail.totalNay()));
        vote.setPresent(orZero(detail.totalPresent()));
        vote.setNotVoting(orZero(detail.totalNotVoting()));
        vote.setVoteDate(CongressMappings.instant(detail.date() != null ? detail.date() : detail.startDate()));
        vote.setDataSource(DataSource.CONGRESS_GOV);
        vote.setLastSyncedAt(Instant.now());

        List<VotePosition> positions = new ArrayList<>();
        if (detail.members() != null) {
            for (HouseVoteMember member : detail.members()) {
                if (member.bioguideId() == null || member.bioguideId().isBlank()) {
                    continue;
                }
                VotePosition position = new VotePosition();
                position.setId(VotePosition.idFor(vote.getId(), member.bioguideId()));
                position.setRollCallId(vote.getId());
                position.setLegislatorId(member.bioguideId());
                position.setPosition(votePosition(member.votePosition()));
                position.setProxy(Boolean.TRUE.equals(member.isProxy()));
                position.setPairedWithId(member.pairedWith());
                positions.add(position);
            }
        }
        return new RollCallBundle(vote, positions);
    }

    /** {@code h118-1-123} for House roll call 123 of the 118th Congress, first session. */
    public static String rollCallId(Chamber chamber, int congress, int session, int rollNumber) {
        String prefix = chamber == Chamber.SENATE ? "s" : "h";
        return prefix + congress + "-" + session + "-" + rollNumber;
    }

    /** Same id format as imported bills, so the reference resolves; null when the vote is not on a bill. */
    static String billReference(HouseVoteDetail.BillRef bill) {
        if (bill == null || bill.type() == null || bill.number() == null || bill.congress() == null) {
            return null;
        }
        try {
            return BillTransformer.billId(bill.type(), Integer.parseInt(bill.number().trim()), bill.congress());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static RollCallVote.VoteResult voteResult(String result) {
        if (result == null) {
            return RollCallVote.VoteResult.PASSED;
        }
        String normalized = result.toLowerCase(Locale.ROOT);
        if (normalized.contains("passed")) {
            return RollCallVote.VoteResult.PASSED;
        }
        if (normalized.contains("agreed")) {
            return RollCallVote.VoteResult.AGREED_TO;
        }
        if (normalized.contains("failed")) {
            return RollCallVote.VoteResult.FAILED;
        }
        if (normalized.contains("rejected")) {
            return RollCallVote.VoteResult.REJECTED;
        }
        return RollCallVote.VoteResult.PASSED;
    }

    static RollCallVote.VoteType voteType(String voteType) {
        if (voteType == null) {
            return RollCallVote.VoteType.ROLL_CALL;
        }
        String normalized = voteType.toLowerCase(Locale.ROOT);
        if (normalized.contains("yea") || normalized.contains("nay")) {
            return RollCallVote.VoteType.ROLL_CALL;
        }
        if (normalized.contains("voice")) {
            return RollCallVote.VoteType.VOICE;
        }
        if (normalized.contains("unanimous")) {
            return RollCallVote.VoteType.UNANIMOUS_CONSENT;
        }
        if (normalized.contains("division")) {
            return RollCallVote.VoteType.DIVISION;
        }
        return RollCallVote.VoteType.ROLL_CALL;
    }

    static RollCallVote.VoteCategory voteCategory(String category) {
        if (category == null) {
            return RollCallVote.VoteCategory.PASSAGE;
        }
        String normalized = category.toLowerCase(Locale.ROOT);
        if (normalized.contains("amendment")) {
            return RollCallVote.VoteCategory.AMENDMENT;
        }
        if (normalized.contains("passage") || normalized.contains("final")) {
            return RollCallVote.VoteCategory.PASSAGE;
        }
        if (normalized.contains("cloture")) {
            return RollCallVote.VoteCategory.CLOTURE;
        }
        if (normalized.contains("recommit")) {
            return RollCallVote.VoteCategory.MOTION_TO_RECOMMIT;
        }
        if (normalized.contains("table")) {
            return RollCallVote.VoteCategory.MOTION_TO_TABLE;
        }
        if (normalized.contains("motion") || normalized.contains("procedural")) {
            return RollCallVote.VoteCategory.PROCEDURAL;
        }
        if (normalized.contains("nomination")) {
            return RollCallVote.VoteCategory.NOMINATION;
        }
        if (normalized.contains("treaty")) {
            return RollCallVote.VoteCategory.TREATY;
        }
        if (normalized.contains("veto")) {
            return RollCallVote.VoteCategory.VETO_OVERRIDE;
        }
        if (normalized.contains("impeachment")) {
            return RollCallVote.VoteCategory.IMPEACHMENT;
        }
        return RollCallVote.VoteCategory.PASSAGE;
    }

    /** yea/aye/yes, nay/no and present; anything else counts as not voting. */
    static VotePosition.Position votePosition(String position) {
        if (position == null) {
            return VotePosition.Position.NOT_VOTING;
        }
        return switch (position.trim().toLowerCase(Locale.ROOT)) {
            case "yea", "aye", "yes" -> VotePosition.Position.YEA;
            case "nay", "no" -> VotePosition.Position.NAY;
            case "present" -> VotePosition.Position.PRESENT;
            default -> VotePosition.Position.NOT_VOTING;
        };
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
