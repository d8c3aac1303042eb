package io.snapshots.financial;

import io.snapshots.core.Stage;
import io.snapshots.core.TimeScope;
import io.snapshots.jobs.JobDescriptor;
import io.snapshots.jobs.JobRegistry;
import io.snapshots.metrics.Metrics;
import io.snapshots.runtime.Stages;
import io.snapshots.sink.IdempotentLoader;
import io.snapshots.sink.IdempotentLoaders;
import io.snapshots.sink.JdbcTarget;
import io.snapshots.sink.TableSchema;
import io.snapshots.sink.VersionedAppendLoader;
import io.snapshots.source.PaginatedExtractor;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The CoinMarketCap snapshot jobs and the loaders behind them.
 */
public class QuoteJobs {
    public static final String LATEST_QUOTES = "cmc_latest_quotes";
    public static final String LISTINGS_DAILY = "cmc_listings_daily";

    private static final Map<TimeScope, String> PRICE_SCHEDULES = Map.of(
            TimeScope.HOURLY, "0 * * * *",
            TimeScope.DAILY, "5 0 * * *",
            TimeScope.WEEKLY, "10 0 * * 1");

    private final SnapshotConfig config;
    private final CoinMarketCapClient client;
    private final Clock clock;
    private final Metrics metrics;
    private final Stages stages;
    private final Map<String, IdempotentLoader> loaders = new LinkedHashMap<>();

    public QuoteJobs(SnapshotConfig config, CoinMarketCapClient client, JdbcTarget target, Metrics metrics, Clock clock) {
        this.config = config;
        this.client = client;
        this.clock = clock;
        this.metrics = metrics;
        this.stages = new Stages(metrics);
        List<TableSchema> schemas = new ArrayList<>();
        for (TimeScope scope : QuoteTables.PRICE_SCOPES) schemas.add(QuoteTables.prices(scope));
        schemas.add(QuoteTables.latestQuotes());
        schemas.add(QuoteTables.listings());
        for (TableSchema s : schemas) {
            loaders.put(s.table(), IdempotentLoaders.forSchema(s, target, config.loadBatchSize(), metrics, clock));
        }
    }

    public static String priceJob(TimeScope scope) {
        return "cmc_prices_" + scope.name().toLowerCase(Locale.ROOT);
    }

    public void registerAll(JobRegistry registry) {
        for (TimeScope scope : QuoteTables.PRICE_SCOPES) {
            register(registry, priceJob(scope), PRICE_SCHEDULES.get(scope),
                    "CoinMarketCap " + scope.name().toLowerCase(Locale.ROOT) + " prices for " + String.join(",", config.symbols()),
                    quotesStage(priceJob(scope), QuoteTables.priceTable(scope)));
        }
        register(registry, LATEST_QUOTES, "*/15 * * * *", "Latest CoinMarketCap quote per symbol",
                quotesStage(LATEST_QUOTES, LATEST_QUOTES));
        register(registry, LISTINGS_DAILY, "30 0 * * *", "Daily snapshot of the CoinMarketCap listings",
                listingsStage());
    }

    private void register(JobRegistry registry, String name, String schedule, String description, Stage stage) {
        JobDescriptor d = JobDescriptor.of(name, schedule, description)
                .withTimeout(config.jobTimeout())
                .withRetryCount(config.jobRetries());
        registry.register(d, stage);
    }

    Stage quotesStage(String name, String table) {
        return stages.etl(name,
                new QuotesExtractor(client, config.symbols(), clock),
                new QuoteTransformer(name, clock, metrics),
                loaders.get(table));
    }

    Stage listingsStage() {
        PaginatedExtractor extractor = new PaginatedExtractor(LISTINGS_DAILY, new ListingsPageFetcher(client, clock),
                config.pageSize(), config.listingsMaxPages(), config.listingsPagePauseMillis(), metrics);
        return stages.etl(LISTINGS_DAILY, extractor, new QuoteTransformer(LISTINGS_DAILY, clock, metrics),
                loaders.get(LISTINGS_DAILY));
    }

    public List<IdempotentLoader> loaders() { return List.copyOf(loaders.values()); }

    public IdempotentLoader loader(String table) { return loaders.get(table); }

    public List<VersionedAppendLoader> appendLoaders() {
        List<VersionedAppendLoader> out = new ArrayList<>();
        for (IdempotentLoader l : loaders.values()) {
            if (l instanceof VersionedAppendLoader v) out.add(v);
        }
        return out;
    }

    /** Creates every target table that does not exist yet. */
    public void createTables() throws Exception {
        for (IdempotentLoader l : loaders.values()) l.createTableIfMissing();
    }
}
