package io.twsecodes.codes.source;

import java.io.IOException;
import java.net.URI;

/**
 * Blocking single-attempt GET.
 */
@FunctionalInterface
public interface PageClient {
    PageResponse get(URI uri) throws IOException, InterruptedException;
}
