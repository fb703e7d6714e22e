package io.twsecodes.codes.store;

import io.twsecodes.codes.schema.CategoryFilter;

/**
 * One storage layer consulted by {@link TieredStore}. Implementations report failures through
 * {@link TierResult.Failed} instead of throwing.
 */
public interface CodesTier {
    String name();

    TierResult lookup(CategoryFilter filter);
}
