package io.snapshots.financial;

import io.snapshots.core.Extractor;
import io.snapshots.core.Record;
import io.snapshots.core.TimeWindow;
import io.snapshots.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Latest quotes for a fixed symbol list, stamped with the fetch time and the snapshot time. The snapshot time is
 * the fetch time for incremental runs and the window start for backfill slices, so a backfilled slice lands in
 * the bucket it stands for.
 */
public class QuotesExtractor implements Extractor {
    private static final Logger log = LoggerFactory.getLogger(QuotesExtractor.class);

    private final CoinMarketCapClient client;
    private final List<String> symbols;
    private final Clock clock;

    public QuotesExtractor(CoinMarketCapClient client, List<String> symbols, Clock clock) {
        if (symbols == null || symbols.isEmpty()) throw new ConfigurationException("no symbols configured");
        this.client = client;
        this.symbols = List.copyOf(symbols);
        this.clock = clock;
    }

    @Override
    public List<Record> extract(TimeWindow window) throws Exception {
        Instant fetchedAt = clock.instant();
        List<Record> coins = CmcResponses.parseQuotes(client.quotesLatest(symbols));
        log.info("Fetched {} quotes for {} symbols", coins.size(), symbols.size());
        return stamp(coins, window, fetchedAt);
    }

    static List<Record> stamp(List<Record> coins, TimeWindow window, Instant fetchedAt) {
        Instant snapshotAt = window.isBackfill() ? window.start() : fetchedAt;
        List<Record> out = new ArrayList<>(coins.size());
        for (Record r : coins) out.add(r.with("fetched_at", fetchedAt).with("recorded_at", snapshotAt));
        return out;
    }

    public List<String> symbols() { return symbols; }
}
