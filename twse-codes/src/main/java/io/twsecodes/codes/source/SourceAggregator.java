package io.twsecodes.codes.source;

import io.twsecodes.codes.error.CodesException;
import io.twsecodes.codes.parse.PageParseTransform;
import io.twsecodes.codes.parse.TableParser;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.core.Transform;
import io.twsecodes.metrics.Metrics;
import io.twsecodes.runtime.SequentialPipeline;
import io.twsecodes.sink.ListSink;
import io.twsecodes.transform.TransformChain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Downloads all listing pages one after another and merges them into a single record set.
 *
 * <p>Fetching is all-or-nothing: a failure on any page aborts the whole run. Records are keyed by
 * symbol; when two pages publish the same symbol the page fetched later wins. The result is sorted
 * by symbol.
 */
public class SourceAggregator {
    private static final Logger LOG = LoggerFactory.getLogger(SourceAggregator.class);

    private final Transform<ListingSource, ListingRecord> transform;
    private final List<ListingSource> order;
    private final Metrics metrics;

    public SourceAggregator(PageClient client, Map<ListingSource, URI> endpoints, Metrics metrics) {
        this(TransformChain.of(new PageFetchTransform(client, endpoints, metrics), new PageParseTransform(new TableParser(), metrics)),
                List.of(ListingSource.values()), metrics);
    }

    public SourceAggregator(Transform<ListingSource, ListingRecord> transform, List<ListingSource> order, Metrics metrics) {
        this.transform = transform;
        this.order = List.copyOf(order);
        this.metrics = metrics == null ? new Metrics(null) : metrics;
    }

    public List<ListingRecord> fetchAll() throws CodesException, InterruptedException {
        ListSink<ListingRecord> sink = new ListSink<>();
        try {
            new SequentialPipeline<>(new ListingSourceList(order), transform, sink, metrics).run();
        } catch (CodesException | InterruptedException | RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CodesException("Fetching listing pages failed: " + e.getMessage(), e);
        }
        List<ListingRecord> merged = merge(sink.items());
        LOG.info("Fetched {} listing records ({} unique) from {} sources", sink.size(), merged.size(), order.size());
        return merged;
    }

    List<ListingRecord> merge(List<ListingRecord> all) {
        TreeMap<String, ListingRecord> bySymbol = new TreeMap<>();
        for (ListingRecord r : all) {
            ListingRecord previous = bySymbol.put(r.symbol(), r);
            if (previous != null) {
                metrics.inc("codes.merge.overridden");
                LOG.debug("Symbol {} published twice; {} replaces {}", r.symbol(), r.category(), previous.category());
            }
        }
        return new ArrayList<>(bySymbol.values());
    }
}
