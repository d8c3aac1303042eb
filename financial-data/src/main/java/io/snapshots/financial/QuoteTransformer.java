package io.snapshots.financial;

import io.snapshots.core.Record;
import io.snapshots.core.Transformer;
import io.snapshots.core.UpsertKey;
import io.snapshots.error.TransformationException;
import io.snapshots.metrics.Metrics;
import io.snapshots.transform.Transformers;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Shapes flattened CMC coins into quote rows. Coins without a symbol or a usable price are dropped. The version
 * is the fetch time, so a later snapshot of the same bucket replaces an earlier one.
 */
public class QuoteTransformer implements Transformer {
    static final List<String> PASS_THROUGH = List.of(
            "name", "slug", "cmc_id", "cmc_rank", "market_cap", "volume_24h",
            "percent_change_1h", "percent_change_24h", "percent_change_7d",
            "circulating_supply", "total_supply", "max_supply", "tags", "last_updated");

    private final Transformer delegate;

    public QuoteTransformer(String pipelineName, Clock clock, Metrics metrics) {
        this.delegate = Transformers.chain(
                Transformers.perRecord(pipelineName, QuoteTransformer::toRow, metrics),
                Transformers.perRecord(pipelineName + ".metadata", Transformers.addMergeMetadata(pipelineName, clock), metrics),
                Transformers.deduplicate(UpsertKey.of("symbol"), "version"));
    }

    @Override
    public List<Record> transform(List<Record> records) throws Exception {
        return delegate.transform(records);
    }

    static Record toRow(Record coin) {
        String symbol = coin.getString("symbol");
        if (symbol == null || symbol.isBlank()) throw new TransformationException("coin without symbol");
        Number price = coin.getNumber("price");
        if (price == null || price.doubleValue() < 0 || Double.isNaN(price.doubleValue())) {
            throw new TransformationException("no usable price for " + symbol);
        }
        Instant fetchedAt = coin.getInstant("fetched_at");
        if (fetchedAt == null) throw new TransformationException("no fetch time for " + symbol);

        Record.Builder b = Record.builder()
                .put("symbol", symbol.trim().toUpperCase(Locale.ROOT))
                .put("price", price);
        for (String c : PASS_THROUGH) b.put(c, coin.get(c));
        Instant recordedAt = coin.getInstant("recorded_at");
        return b.put("fetched_at", fetchedAt)
                .put("recorded_at", recordedAt != null ? recordedAt : fetchedAt)
                .put("version", fetchedAt.toEpochMilli())
                .build();
    }
}
