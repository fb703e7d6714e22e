package io.twsecodes.codes.source;

import io.twsecodes.codes.error.TransportException;
import io.twsecodes.core.Record;
import io.twsecodes.core.Transform;
import io.twsecodes.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Downloads the page behind a {@link ListingSource}. Anything but HTTP 200 fails the transform.
 */
public class PageFetchTransform implements Transform<ListingSource, FetchedPage> {
    private static final Logger LOG = LoggerFactory.getLogger(PageFetchTransform.class);

    private final PageClient client;
    private final Map<ListingSource, URI> endpoints;
    private final Metrics metrics;

    public PageFetchTransform(PageClient client, Map<ListingSource, URI> endpoints, Metrics metrics) {
        this.client = client;
        this.endpoints = new EnumMap<>(ListingSource.class);
        for (ListingSource s : ListingSource.values()) {
            this.endpoints.put(s, endpoints == null ? s.defaultUri() : endpoints.getOrDefault(s, s.defaultUri()));
        }
        this.metrics = metrics == null ? new Metrics(null) : metrics;
    }

    @Override
    public List<Record<FetchedPage>> apply(Record<ListingSource> input) throws TransportException, InterruptedException {
        ListingSource source = input.payload();
        URI uri = endpoints.get(source);
        LOG.info("Fetching {} listing from {}", source, uri);
        PageResponse resp;
        try {
            resp = client.get(uri);
        } catch (IOException e) {
            metrics.inc("codes.fetch.failures");
            throw new TransportException(uri, e);
        }
        if (!resp.isOk()) {
            metrics.inc("codes.fetch.failures");
            throw new TransportException(uri, resp.status());
        }
        metrics.inc("codes.fetch.pages");
        return List.of(input.withPayload(0, new FetchedPage(source, uri, resp.body(), resp.charset())));
    }
}
