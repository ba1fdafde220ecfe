package com.capitolsync.ingestion.transform;

import com.capitolsync.domain.Bill;
import com.capitolsync.domain.DataSource;
import com.capitolsync.ingestion.client.model.BillListItem;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Locale;

/**
 * Maps a bill list entry to a {@link Bill}. Status is inferred from the latest action text since the
 * upstream list carries no explicit status.
 */
@Component
public class BillTransformer {

    public Bill transform(BillListItem item) {
        if (item.congress() == null) {
            throw new TransformException("Bill without congress");
        }
        Bill.BillType type = CongressMappings.billType(item.type());
        int number = CongressMappings.parseNumber(item.number(), "bill number");

        Bill bill = new Bill();
        bill.setId(billId(item.type(), number, item.congress()));
        bill.setCongress(item.congress());
        bill.setBillType(type);
        bill.setBillNumber(number);
        bill.setTitle(item.title());
        String actionText = item.latestAction() != null ? item.latestAction().text() : null;
        bill.setStatus(inferStatus(actionText));
        bill.setLatestActionText(actionText);
        bill.setLastActionDate(item.latestAction() != null ? CongressMappings.date(item.latestAction().actionDate()) : null);
        bill.setIntroducedDate(CongressMappings.date(item.updateDate()));
        bill.setOriginChamber(CongressMappings.chamber(item.originChamber()));
        bill.setDataSource(DataSource.CONGRESS_GOV);
        bill.setLastSyncedAt(Instant.now());
        return bill;
    }

    /** {@code <type>-<number>-<congress>}, type lower-cased, e.g. {@code hr-1234-118}. */
    public static String billId(String type, int number, int congress) {
        return type.trim().toLowerCase(Locale.ROOT) + "-" + number + "-" + congress;
    }

    /**
     * First matching rule wins; terminal outcomes are checked before progress milestones.
     */
    public static Bill.BillStatus inferStatus(String latestActionText) {
        if (latestActionText == null || latestActionText.isBlank()) {
            return Bill.BillStatus.INTRODUCED;
        }
        String text = latestActionText.toLowerCase(Locale.ROOT);
        if (text.contains("became public law") || text.contains("became law")) {
            return Bill.BillStatus.ENACTED;
        }
        if (text.contains("signed by president") || text.contains("signed by the president")) {
            return Bill.BillStatus.SIGNED_INTO_LAW;
        }
        if (text.contains("pocket vetoed") || text.contains("pocket veto")) {
            return Bill.BillStatus.POCKET_VETOED;
        }
        if (text.contains("vetoed by president") || text.contains("vetoed by the president")) {
            return Bill.BillStatus.VETOED;
        }
        if (text.contains("veto overridden")) {
            return Bill.BillStatus.VETO_OVERRIDDEN;
        }
        if (text.contains("failed") || text.contains("rejected")) {
            return Bill.BillStatus.FAILED;
        }
        if (text.contains("withdrawn") || text.contains("withdrew")) {
            return Bill.BillStatus.WITHDRAWN;
        }
        if (text.contains("presented to president") || text.contains("sent to president")) {
            return Bill.BillStatus.TO_PRESIDENT;
        }
        if (text.contains("resolving differences") || text.contains("conference")) {
            return Bill.BillStatus.RESOLVING_DIFFERENCES;
        }
        if (text.contains("passed senate") || text.contains("agreed to in senate")) {
            return Bill.BillStatus.PASSED_SENATE;
        }
        if (text.contains("passed house") || text.contains("agreed to in house")) {
            return Bill.BillStatus.PASSED_HOUSE;
        }
        if (text.contains("reported by") || text.contains("ordered to be reported")) {
            return Bill.BillStatus.REPORTED_BY_COMMITTEE;
        }
        if (text.contains("referred to") || text.contains("committee")) {
            return Bill.BillStatus.IN_COMMITTEE;
        }
        return Bill.BillStatus.INTRODUCED;
    }
}
