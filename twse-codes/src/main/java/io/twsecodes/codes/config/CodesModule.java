package io.twsecodes.codes.config;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.twsecodes.codes.DownloadOrchestrator;
import io.twsecodes.codes.source.HttpPageClient;
import io.twsecodes.codes.source.PageClient;
import io.twsecodes.codes.source.SourceAggregator;
import io.twsecodes.codes.store.CodesRepository;
import io.twsecodes.codes.store.ConnectionProvider;
import io.twsecodes.codes.store.CsvFallbackTier;
import io.twsecodes.codes.store.DiskCacheTier;
import io.twsecodes.codes.store.DriverManagerConnectionProvider;
import io.twsecodes.codes.store.JdbcCodesRepository;
import io.twsecodes.codes.store.TieredStore;
import io.twsecodes.metrics.Metrics;

public class CodesModule extends AbstractModule {
    private final CodesConfig config;

    public CodesModule(CodesConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(CodesConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton PageClient pageClient() { return new HttpPageClient(config.httpTimeout()); }

    @Provides @Singleton ConnectionProvider connectionProvider() {
        return new DriverManagerConnectionProvider(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword());
    }

    @Provides @Singleton CodesRepository repository(ConnectionProvider connections) { return new JdbcCodesRepository(connections); }

    @Provides @Singleton DiskCacheTier cache() { return new DiskCacheTier(config.cacheDir()); }

    @Provides @Singleton CsvFallbackTier fallback() {
        return config.fallbackCsv() == null ? CsvFallbackTier.bundled() : CsvFallbackTier.ofFile(config.fallbackCsv());
    }

    @Provides @Singleton SourceAggregator aggregator(PageClient client, Metrics metrics) {
        return new SourceAggregator(client, config.endpoints(), metrics);
    }

    @Provides @Singleton DownloadOrchestrator orchestrator(SourceAggregator aggregator, CodesRepository repository, DiskCacheTier cache, Metrics metrics) {
        return new DownloadOrchestrator(aggregator, repository, cache, metrics);
    }

    @Provides @Singleton TieredStore tieredStore(DiskCacheTier cache, CodesRepository repository, CsvFallbackTier fallback,
                                                 DownloadOrchestrator orchestrator, Metrics metrics) {
        return new TieredStore(cache, repository, fallback, orchestrator, metrics);
    }
}
