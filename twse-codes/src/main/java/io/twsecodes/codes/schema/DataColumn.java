package io.twsecodes.codes.schema;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Columns of a listing record in their fixed serialization order. Each column has a short
 * machine key (CSV header, SQL column) and the label the exchange prints above it.
 */
public enum DataColumn {
    SYMBOL("sc", "代號"),
    NAME("cn", "名稱"),
    CATEGORY("ca", "類別"),
    ISIN_CODE("ic", "國際證券辨識號碼(ISIN Code)"),
    DATE_OF_LISTING("dl", "上市日"),
    MARKET_TYPE("ma", "市場別"),
    INDUSTRY("si", "產業別"),
    CFI_CODE("cc", "CFICode"),
    NOTES("no", "備註");

    private static final Map<String, DataColumn> BY_SHORT = new LinkedHashMap<>();
    private static final Map<String, DataColumn> BY_LABEL = new LinkedHashMap<>();

    static {
        for (DataColumn c : values()) {
            BY_SHORT.put(c.shortName, c);
            BY_LABEL.put(c.label, c);
        }
    }

    private final String shortName;
    private final String label;

    DataColumn(String shortName, String label) {
        this.shortName = shortName;
        this.label = label;
    }

    public String shortName() { return shortName; }
    public String label() { return label; }

    public static Optional<DataColumn> fromShortName(String key) {
        return Optional.ofNullable(BY_SHORT.get(key));
    }

    public static Optional<DataColumn> fromLabel(String label) {
        return Optional.ofNullable(BY_LABEL.get(label));
    }

    public static List<String> shortNames() {
        return List.copyOf(BY_SHORT.keySet());
    }

    public static List<String> labels() {
        return Arrays.stream(values()).map(DataColumn::label).toList();
    }

    public static int count() { return BY_SHORT.size(); }
}
