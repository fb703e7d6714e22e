package io.twsecodes.codes.schema;

import io.twsecodes.codes.error.UnrecognizedCategoryException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;

/**
 * Conversions between {@link ListingRecord} and flat rows in {@link DataColumn} order.
 * The category cell holds the published label, not the enum name.
 */
public final class RecordSchema {
    public static final Comparator<ListingRecord> BY_SYMBOL = Comparator.comparing(ListingRecord::symbol);

    private RecordSchema() {}

    public static List<String> header() {
        return DataColumn.shortNames();
    }

    public static String[] toRow(ListingRecord r) {
        return new String[] {
                r.symbol(),
                r.name(),
                r.category().label(),
                r.isinCode(),
                r.dateOfListing(),
                r.marketType(),
                r.industry(),
                r.cfiCode(),
                r.notes() == null ? "" : r.notes()
        };
    }

    /**
     * @throws IllegalArgumentException when the row has the wrong arity or a malformed symbol
     */
    public static ListingRecord fromRow(List<String> row) throws UnrecognizedCategoryException {
        if (row.size() != DataColumn.count()) {
            throw new IllegalArgumentException("Expected " + DataColumn.count() + " columns, got " + row.size() + ": " + row);
        }
        return new ListingRecord(
                row.get(DataColumn.SYMBOL.ordinal()),
                row.get(DataColumn.NAME.ordinal()),
                CodesCategory.fromLabel(row.get(DataColumn.CATEGORY.ordinal())),
                row.get(DataColumn.ISIN_CODE.ordinal()),
                row.get(DataColumn.DATE_OF_LISTING.ordinal()),
                row.get(DataColumn.MARKET_TYPE.ordinal()),
                row.get(DataColumn.INDUSTRY.ordinal()),
                row.get(DataColumn.CFI_CODE.ordinal()),
                row.get(DataColumn.NOTES.ordinal()));
    }

    /**
     * Keeps the last record seen for each symbol and returns them sorted by symbol.
     */
    public static List<ListingRecord> mergeBySymbol(Collection<ListingRecord> records) {
        TreeMap<String, ListingRecord> bySymbol = new TreeMap<>();
        for (ListingRecord r : records) bySymbol.put(r.symbol(), r);
        return new ArrayList<>(bySymbol.values());
    }

    public static List<ListingRecord> filter(Collection<ListingRecord> records, CategoryFilter filter) {
        List<ListingRecord> out = new ArrayList<>();
        for (ListingRecord r : records) {
            if (filter.matches(r.category())) out.add(r);
        }
        return out;
    }
}
