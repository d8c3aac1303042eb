package io.snapshots.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.snapshots.backfill.FileWatermarkStore;
import io.snapshots.backfill.WatermarkStore;
import io.snapshots.jobs.JobCommands;
import io.snapshots.jobs.JobRegistry;
import io.snapshots.metrics.Metrics;
import io.snapshots.sink.JdbcTarget;

import java.io.IOException;
import java.time.Clock;

public class MarketDataModule extends AbstractModule {
    private final SnapshotConfig config;
    private final CoinMarketCapClient client;

    public MarketDataModule(SnapshotConfig config) { this(config, null); }

    /** @param client API client to use instead of the HTTP one, or null */
    public MarketDataModule(SnapshotConfig config, CoinMarketCapClient client) {
        this.config = config;
        this.client = client;
    }

    @Override
    protected void configure() {
        bind(SnapshotConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton WatermarkStore watermarkStore() throws IOException { return new FileWatermarkStore(config.watermarkFile()); }

    @Provides @Singleton JdbcTarget jdbcTarget() { return new JdbcTarget(config.jdbcUrl(), config.jdbcUser(), config.jdbcPassword()); }

    @Provides @Singleton CoinMarketCapClient coinMarketCapClient() {
        return client != null ? client : new HttpCoinMarketCapClient(config.cmcBaseUrl(), config.cmcApiKey());
    }

    @Provides @Singleton QuoteJobs quoteJobs(CoinMarketCapClient cmc, JdbcTarget target, Metrics metrics, Clock clock) {
        return new QuoteJobs(config, cmc, target, metrics, clock);
    }

    @Provides @Singleton JobRegistry jobRegistry(WatermarkStore watermarks, Metrics metrics, Clock clock, QuoteJobs jobs) {
        JobRegistry registry = new JobRegistry(watermarks, config.lookback(), config.backfillWatermarkPolicy(), clock, metrics);
        jobs.registerAll(registry);
        return registry;
    }

    @Provides @Singleton JobCommands jobCommands(JobRegistry registry) { return new JobCommands(registry); }
}
