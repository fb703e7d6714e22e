package io.twsecodes.codes;

import io.twsecodes.codes.schema.ListingRecord;

import java.util.List;
import java.util.Optional;

/**
 * Records from a forced refresh and whether they made it into the persisted store.
 */
public record RefreshResult(List<ListingRecord> records, boolean persisted, String warning) {
    public RefreshResult {
        records = List.copyOf(records);
    }

    public static RefreshResult persisted(List<ListingRecord> records) {
        return new RefreshResult(records, true, null);
    }

    public static RefreshResult notPersisted(List<ListingRecord> records, String warning) {
        return new RefreshResult(records, false, warning);
    }

    public Optional<String> warningMessage() { return Optional.ofNullable(warning); }
}
