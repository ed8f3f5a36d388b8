package com.eainde.policylens.store;

import com.eainde.policylens.model.Verdict;

import java.time.Instant;

/**
 * Selection criteria for stored decisions. Null fields do not restrict.
 *
 * @param verdict      only decisions with this verdict
 * @param storedFrom   stored at or after (inclusive)
 * @param storedTo     stored at or before (inclusive)
 * @param snapshotAt   stored at or before (inclusive); the snapshot cutoff of batch scans
 */
public record DecisionFilter(
        Verdict verdict,
        Instant storedFrom,
        Instant storedTo,
        Instant snapshotAt
) {

    private static final DecisionFilter ALL = new DecisionFilter(null, null, null, null);

    public static DecisionFilter all() {
        return ALL;
    }

    public static DecisionFilter ofVerdict(Verdict verdict) {
        return new DecisionFilter(verdict, null, null, null);
    }

    public DecisionFilter withSnapshotAt(Instant cutoff) {
        return new DecisionFilter(verdict, storedFrom, storedTo, cutoff);
    }
}
