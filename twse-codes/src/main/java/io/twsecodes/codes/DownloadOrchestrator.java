package io.twsecodes.codes;

import io.twsecodes.codes.error.CodesException;
import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.codes.source.SourceAggregator;
import io.twsecodes.codes.store.CodesRepository;
import io.twsecodes.codes.store.DiskCacheTier;
import io.twsecodes.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Forced refresh: download every listing page and replace the persisted table with the result.
 *
 * <p>Download and parse failures propagate and leave storage untouched. A storage failure after a
 * successful download does not: the records are still returned, flagged as not persisted.
 */
public class DownloadOrchestrator {
    private static final Logger LOG = LoggerFactory.getLogger(DownloadOrchestrator.class);

    private final SourceAggregator aggregator;
    private final CodesRepository repository;
    private final DiskCacheTier cache;
    private final Metrics metrics;

    public DownloadOrchestrator(SourceAggregator aggregator, CodesRepository repository, DiskCacheTier cache, Metrics metrics) {
        this.aggregator = aggregator;
        this.repository = repository;
        this.cache = cache;
        this.metrics = metrics == null ? new Metrics(null) : metrics;
    }

    public RefreshResult refresh() throws CodesException, InterruptedException {
        metrics.inc("codes.refresh.count");
        List<ListingRecord> records = aggregator.fetchAll();
        if (records.isEmpty()) {
            LOG.warn("Refresh fetched no records; persisted table left unchanged");
            return RefreshResult.notPersisted(records, "No records fetched; persisted table left unchanged");
        }

        String warning = null;
        try {
            int affected = repository.replaceAll(records);
            if (affected == 0) {
                warning = "Could not insert data into database: 0 of " + records.size() + " rows written";
            }
        } catch (StorageException e) {
            warning = e.getMessage();
        }
        if (warning != null) {
            metrics.inc("codes.refresh.persist.failures");
            LOG.warn("Refresh fetched {} records but did not persist them: {}", records.size(), warning);
            return RefreshResult.notPersisted(records, warning);
        }

        if (cache != null) {
            try {
                cache.invalidate();
            } catch (StorageException e) {
                LOG.warn("Refreshed codes persisted but stale cache files remain: {}", e.getMessage());
            }
        }
        LOG.info("Refreshed {} listing records", records.size());
        return RefreshResult.persisted(records);
    }
}
