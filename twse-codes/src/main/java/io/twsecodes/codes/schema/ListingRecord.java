package io.twsecodes.codes.schema;

import java.util.Objects;

/**
 * One listed security or index.
 *
 * @param symbol        unique key, never blank, no whitespace
 * @param dateOfListing YYYYMMDD, empty for rows the exchange publishes without one
 * @param notes         null when the exchange leaves the column blank
 */
public record ListingRecord(
        String symbol,
        String name,
        CodesCategory category,
        String isinCode,
        String dateOfListing,
        String marketType,
        String industry,
        String cfiCode,
        String notes
) {
    public ListingRecord {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(category, "category");
        if (symbol.isEmpty() || symbol.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid symbol: '" + symbol + "'");
        }
        name = nullToEmpty(name);
        isinCode = nullToEmpty(isinCode);
        dateOfListing = nullToEmpty(dateOfListing);
        marketType = nullToEmpty(marketType);
        industry = nullToEmpty(industry);
        cfiCode = nullToEmpty(cfiCode);
        notes = notes == null || notes.isBlank() ? null : notes;
    }

    private static String nullToEmpty(String s) { return s == null ? "" : s; }
}
