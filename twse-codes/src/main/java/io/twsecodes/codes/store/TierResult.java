package io.twsecodes.codes.store;

import io.twsecodes.codes.schema.ListingRecord;

import java.util.List;

/**
 * Outcome of asking one storage tier for records.
 */
public sealed interface TierResult permits TierResult.Found, TierResult.NotFound, TierResult.Failed {

    record Found(List<ListingRecord> records) implements TierResult {
        public Found {
            records = List.copyOf(records);
            if (records.isEmpty()) throw new IllegalArgumentException("Found requires at least one record");
        }
    }

    record NotFound(String reason) implements TierResult {}

    record Failed(String detail, Exception cause) implements TierResult {}

    static TierResult of(List<ListingRecord> records, String emptyReason) {
        return records.isEmpty() ? new NotFound(emptyReason) : new Found(records);
    }

    static TierResult failed(String detail, Exception cause) {
        return new Failed(detail, cause);
    }
}
