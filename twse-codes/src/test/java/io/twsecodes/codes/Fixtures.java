package io.twsecodes.codes;

import io.twsecodes.codes.schema.CodesCategory;
import io.twsecodes.codes.schema.ListingRecord;

import java.util.List;

public final class Fixtures {
    private Fixtures() {}

    public static ListingRecord record(String symbol, CodesCategory category) {
        return new ListingRecord(symbol, "name-" + symbol, category, "TW" + symbol, "20010101", "上市", "", "ESVUFR", null);
    }

    public static final List<ListingRecord> SAMPLE = List.of(
            record("0050", CodesCategory.ETF),
            record("1101", CodesCategory.STOCK),
            new ListingRecord("2330", "台積電", CodesCategory.STOCK, "TW0002330008", "19940905", "上市", "半導體業", "ESVUFR", "Note, with \"quotes\""),
            record("2881A", CodesCategory.SPECIAL_STOCK),
            new ListingRecord("IX0001", "發行量加權股價指數", CodesCategory.INDEX, "TW0000IX0012", "", "", "", "MRIXXX", null));
}
