package io.twsecodes.codes.schema;

import java.util.Locale;
import java.util.Objects;

/**
 * What a query asks for: one category, or everything.
 */
public sealed interface CategoryFilter permits CategoryFilter.Specific, CategoryFilter.All {

    String ALL_NAME = "ALL";

    boolean matches(CodesCategory category);

    /** Cache file stem and log label. */
    String key();

    record Specific(CodesCategory category) implements CategoryFilter {
        public Specific {
            Objects.requireNonNull(category, "category");
        }

        @Override
        public boolean matches(CodesCategory c) { return category == c; }

        @Override
        public String key() { return category.lowerName(); }
    }

    record All() implements CategoryFilter {
        @Override
        public boolean matches(CodesCategory c) { return true; }

        @Override
        public String key() { return "all"; }
    }

    static CategoryFilter all() { return new All(); }

    static CategoryFilter of(CodesCategory category) { return new Specific(category); }

    /**
     * Parses {@code ALL} or a category enum name, case-insensitively.
     *
     * @throws IllegalArgumentException for anything else
     */
    static CategoryFilter parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Cannot find category: '" + text + "'");
        }
        if (ALL_NAME.equals(text.strip().toUpperCase(Locale.ROOT))) return all();
        return CodesCategory.lookupName(text)
                .<CategoryFilter>map(Specific::new)
                .orElseThrow(() -> new IllegalArgumentException("Cannot find category: '" + text + "'"));
    }
}
