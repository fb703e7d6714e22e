package io.twsecodes.codes.store;

import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.schema.ListingRecord;

import java.util.List;

/**
 * Persisted tier that can also be rewritten wholesale.
 */
public interface CodesRepository extends CodesTier {
    /**
     * Replaces the whole table with {@code records}.
     *
     * @return number of rows written
     */
    int replaceAll(List<ListingRecord> records) throws StorageException;
}
