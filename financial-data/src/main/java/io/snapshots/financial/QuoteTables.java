package io.snapshots.financial;

import io.snapshots.core.TimeScope;
import io.snapshots.sink.ColumnType;
import io.snapshots.sink.LoadStrategy;
import io.snapshots.sink.TableSchema;

import java.util.List;
import java.util.Locale;

/**
 * Target tables of the quote jobs. Time-scoped price tables are append-only with one logical row per symbol and
 * bucket; the latest-quotes table holds a single row per symbol.
 */
public final class QuoteTables {
    private QuoteTables() {}

    public static final List<TimeScope> PRICE_SCOPES = List.of(TimeScope.HOURLY, TimeScope.DAILY, TimeScope.WEEKLY);

    public static String priceTable(TimeScope scope) {
        return "crypto_prices_" + scope.name().toLowerCase(Locale.ROOT);
    }

    public static TableSchema prices(TimeScope scope) {
        return quoteColumns(TableSchema.builder(priceTable(scope)))
                .bucket("bucket_start", scope, ColumnType.TIMESTAMP)
                .bucket("bucket_date", TimeScope.DAILY, ColumnType.DATE)
                .key("symbol", "bucket_start")
                .strategy(LoadStrategy.VERSIONED_APPEND)
                .build();
    }

    public static TableSchema latestQuotes() {
        return quoteColumns(TableSchema.builder("cmc_latest_quotes"))
                .key("symbol")
                .strategy(LoadStrategy.DELETE_INSERT)
                .build();
    }

    public static TableSchema listings() {
        return quoteColumns(TableSchema.builder("cmc_listings_daily"))
                .bucket("bucket_date", TimeScope.DAILY, ColumnType.DATE)
                .key("symbol", "bucket_date")
                .strategy(LoadStrategy.VERSIONED_APPEND)
                .build();
    }

    private static TableSchema.Builder quoteColumns(TableSchema.Builder b) {
        return b.required("symbol", ColumnType.STRING)
                .column("name", ColumnType.STRING)
                .column("slug", ColumnType.STRING)
                .column("cmc_id", ColumnType.LONG)
                .column("cmc_rank", ColumnType.INT)
                .column("price", ColumnType.DECIMAL)
                .column("market_cap", ColumnType.DECIMAL)
                .column("volume_24h", ColumnType.DECIMAL)
                .column("percent_change_1h", ColumnType.DECIMAL)
                .column("percent_change_24h", ColumnType.DECIMAL)
                .column("percent_change_7d", ColumnType.DECIMAL)
                .column("circulating_supply", ColumnType.DECIMAL)
                .column("total_supply", ColumnType.DECIMAL)
                .column("max_supply", ColumnType.DECIMAL)
                .required("tags", ColumnType.STRING)
                .column("last_updated", ColumnType.TIMESTAMP)
                .column("fetched_at", ColumnType.TIMESTAMP)
                .required("recorded_at", ColumnType.TIMESTAMP)
                .required("pipeline_name", ColumnType.STRING)
                .column("merged_at", ColumnType.TIMESTAMP)
                .required("version", ColumnType.LONG)
                .version("version")
                .recordedAt("recorded_at");
    }
}
