package io.twsecodes.codes.schema;

import io.twsecodes.codes.error.UnrecognizedCategoryException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Instrument categories, each tied to the section header printed on the listing page.
 * INDEX never appears as a header; it is assigned to every row of the futures/index page.
 */
public enum CodesCategory {
    STOCK("股票"),
    WARRANT("上市認購(售)權證"),
    SPECIAL_STOCK("特別股"),
    INNOVATION_BOARD("創新板"),
    ETF("ETF"),
    ETN("ETN"),
    TDR("臺灣存託憑證(TDR)"),
    ASSET_BASED_SECURITIES("受益證券-資產基礎證券"),
    REIT("受益證券-不動產投資信託"),
    OTC_WARRANT("上櫃認購(售)權證"),
    INDEX("指數");

    private static final Map<String, CodesCategory> BY_LABEL = new HashMap<>();

    static {
        for (CodesCategory c : values()) BY_LABEL.put(c.label, c);
    }

    private final String label;

    CodesCategory(String label) {
        this.label = label;
    }

    public String label() { return label; }

    /** Stem used for per-category cache files, e.g. {@code special_stock}. */
    public String lowerName() { return name().toLowerCase(Locale.ROOT); }

    public static Optional<CodesCategory> lookupLabel(String label) {
        return label == null ? Optional.empty() : Optional.ofNullable(BY_LABEL.get(label.strip()));
    }

    public static CodesCategory fromLabel(String label) throws UnrecognizedCategoryException {
        return lookupLabel(label).orElseThrow(() -> new UnrecognizedCategoryException(label));
    }

    public static Optional<CodesCategory> lookupName(String name) {
        if (name == null) return Optional.empty();
        try {
            return Optional.of(valueOf(name.strip().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
