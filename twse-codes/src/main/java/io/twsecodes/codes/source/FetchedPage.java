package io.twsecodes.codes.source;

import java.net.URI;

/**
 * A successfully downloaded listing page, not yet parsed.
 */
public record FetchedPage(ListingSource source, URI uri, byte[] body, String charset) {}
