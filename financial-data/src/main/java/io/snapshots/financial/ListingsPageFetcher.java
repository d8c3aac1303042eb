package io.snapshots.financial;

import io.snapshots.core.Record;
import io.snapshots.core.TimeWindow;
import io.snapshots.source.PageFetcher;

import java.time.Clock;
import java.util.List;

/** Pages through listings/latest; CMC's {@code start} is the 1-based rank, so offset 0 maps to start 1. */
public class ListingsPageFetcher implements PageFetcher {
    private final CoinMarketCapClient client;
    private final Clock clock;

    public ListingsPageFetcher(CoinMarketCapClient client, Clock clock) {
        this.client = client;
        this.clock = clock;
    }

    @Override
    public List<Record> fetch(TimeWindow window, int limit, int offset) throws Exception {
        List<Record> page = CmcResponses.parseListings(client.listingsLatest(offset + 1, limit));
        return QuotesExtractor.stamp(page, window, clock.instant());
    }
}
