package io.twsecodes.codes.source;

import io.twsecodes.codes.schema.CodesCategory;

import java.net.URI;
import java.util.Optional;

/**
 * The three ISIN listing pages, in the order they are fetched and merged.
 */
public enum ListingSource {
    LISTED("https://isin.twse.com.tw/isin/C_public.jsp?strMode=2", null),
    OTC("https://isin.twse.com.tw/isin/C_public.jsp?strMode=4", null),
    FUTURES_INDEX("https://isin.twse.com.tw/isin/C_public.jsp?strMode=11", CodesCategory.INDEX);

    private final URI defaultUri;
    private final CodesCategory fixedCategory;

    ListingSource(String defaultUri, CodesCategory fixedCategory) {
        this.defaultUri = URI.create(defaultUri);
        this.fixedCategory = fixedCategory;
    }

    public URI defaultUri() { return defaultUri; }

    /**
     * Category applied to every row of the page; empty when the page carries category header rows.
     */
    public Optional<CodesCategory> fixedCategory() { return Optional.ofNullable(fixedCategory); }
}
