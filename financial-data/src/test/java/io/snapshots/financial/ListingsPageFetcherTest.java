package io.snapshots.financial;

import io.snapshots.core.Record;
import io.snapshots.core.TimeWindow;
import io.snapshots.metrics.Metrics;
import io.snapshots.source.PaginatedExtractor;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ListingsPageFetcherTest {
    private static final Instant NOW = Instant.parse("2024-05-10T00:30:00Z");
    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);

    @Test
    void offset_maps_to_one_based_start() throws Exception {
        FakeCmcClient client = new FakeCmcClient().price("BTC", "1").price("ETH", "2").price("SOL", "3");
        ListingsPageFetcher fetcher = new ListingsPageFetcher(client, clock);

        List<Record> page = fetcher.fetch(TimeWindow.incremental(NOW.minusSeconds(3600), NOW), 2, 2);

        assertEquals(1, page.size());
        assertEquals("SOL", page.get(0).getString("symbol"));
        assertArrayEquals(new int[]{3, 2}, client.listingRequests.get(0));
        assertEquals(NOW, page.get(0).getInstant("fetched_at"));
    }

    @Test
    void paginates_until_a_short_page() throws Exception {
        FakeCmcClient client = new FakeCmcClient()
                .price("BTC", "1").price("ETH", "2").price("SOL", "3").price("ADA", "4").price("XRP", "5");
        PaginatedExtractor extractor = new PaginatedExtractor("listings", new ListingsPageFetcher(client, clock), 2, 10, 0, Metrics.noop());

        List<Record> all = extractor.extract(TimeWindow.incremental(NOW.minusSeconds(3600), NOW));

        assertEquals(List.of("BTC", "ETH", "SOL", "ADA", "XRP"), all.stream().map(r -> r.getString("symbol")).toList());
        assertEquals(3, client.listingRequests.size());
        assertEquals(1, client.listingRequests.get(0)[0]);
        assertEquals(3, client.listingRequests.get(1)[0]);
        assertEquals(5, client.listingRequests.get(2)[0]);
    }
}
