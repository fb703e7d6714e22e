package io.twsecodes.codes.store;

import io.twsecodes.codes.DownloadOrchestrator;
import io.twsecodes.codes.RefreshResult;
import io.twsecodes.codes.error.CodesException;
import io.twsecodes.codes.error.CodesNotFoundException;
import io.twsecodes.codes.error.StorageException;
import io.twsecodes.codes.schema.CategoryFilter;
import io.twsecodes.codes.schema.CodesCategory;
import io.twsecodes.codes.schema.ListingRecord;
import io.twsecodes.codes.schema.RecordSchema;
import io.twsecodes.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Answers code queries from the first tier that has data:
 * <ol>
 *   <li>disk cache,</li>
 *   <li>persisted store,</li>
 *   <li>bundled CSV,</li>
 *   <li>a forced refresh.</li>
 * </ol>
 * A hit in tier 2 or 3 is copied into the disk cache for the same query. Tier failures are logged
 * and skipped; only an empty forced refresh, or a failing one, fails the query.
 * Results are deduplicated and ordered by symbol.
 */
public class TieredStore {
    private static final Logger LOG = LoggerFactory.getLogger(TieredStore.class);

    private final DiskCacheTier cache;
    private final List<CodesTier> lowerTiers;
    private final DownloadOrchestrator orchestrator;
    private final Metrics metrics;

    public TieredStore(DiskCacheTier cache, List<CodesTier> lowerTiers, DownloadOrchestrator orchestrator, Metrics metrics) {
        this.cache = cache;
        this.lowerTiers = List.copyOf(lowerTiers);
        this.orchestrator = orchestrator;
        this.metrics = metrics == null ? new Metrics(null) : metrics;
    }

    public TieredStore(DiskCacheTier cache, CodesRepository repository, CsvFallbackTier fallback,
                       DownloadOrchestrator orchestrator, Metrics metrics) {
        this(cache, List.of(repository, fallback), orchestrator, metrics);
    }

    public List<ListingRecord> query(CategoryFilter filter) throws CodesException, InterruptedException {
        List<ListingRecord> hit = resolve(cache, filter);
        if (hit != null) return hit;

        for (CodesTier tier : lowerTiers) {
            hit = resolve(tier, filter);
            if (hit != null) {
                writeThrough(filter, hit);
                return hit;
            }
        }

        LOG.info("No tier has {} codes, forcing a refresh", filter.key());
        RefreshResult refreshed;
        try {
            refreshed = orchestrator.refresh();
        } catch (CodesException e) {
            throw new CodesNotFoundException(filter.key(), e);
        }
        List<ListingRecord> records = shape(refreshed.records(), filter);
        if (records.isEmpty()) throw new CodesNotFoundException(filter.key());
        metrics.inc("codes.tier.refresh.hit");
        return records;
    }

    public List<ListingRecord> all() throws CodesException, InterruptedException {
        return query(CategoryFilter.all());
    }

    public List<String> stockSymbols() throws CodesException, InterruptedException {
        return query(CategoryFilter.of(CodesCategory.STOCK)).stream().map(ListingRecord::symbol).toList();
    }

    /** Null when the tier has nothing usable. */
    private List<ListingRecord> resolve(CodesTier tier, CategoryFilter filter) {
        TierResult result = tier.lookup(filter);
        if (result instanceof TierResult.Found found) {
            List<ListingRecord> records = shape(found.records(), filter);
            if (!records.isEmpty()) {
                metrics.inc("codes.tier." + tier.name() + ".hit");
                LOG.debug("{} codes served by {} ({} records)", filter.key(), tier.name(), records.size());
                return records;
            }
            metrics.inc("codes.tier." + tier.name() + ".miss");
        } else if (result instanceof TierResult.NotFound notFound) {
            metrics.inc("codes.tier." + tier.name() + ".miss");
            LOG.debug("{} tier miss for {}: {}", tier.name(), filter.key(), notFound.reason());
        } else if (result instanceof TierResult.Failed failed) {
            metrics.inc("codes.tier." + tier.name() + ".error");
            LOG.warn("{} tier failed for {}, falling through: {}", tier.name(), filter.key(), failed.detail());
        }
        return null;
    }

    private void writeThrough(CategoryFilter filter, List<ListingRecord> records) {
        try {
            cache.store(filter, records);
        } catch (StorageException e) {
            LOG.warn("Could not cache {} codes: {}", filter.key(), e.getMessage());
        }
    }

    private static List<ListingRecord> shape(List<ListingRecord> records, CategoryFilter filter) {
        return RecordSchema.mergeBySymbol(RecordSchema.filter(records, filter));
    }
}
