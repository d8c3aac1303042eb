package io.snapshots.source;

import com.codahale.metrics.Counter;
import io.snapshots.core.Extractor;
import io.snapshots.core.Record;
import io.snapshots.core.TimeWindow;
import io.snapshots.error.ConfigurationException;
import io.snapshots.error.ExtractionException;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Calls a {@link PageFetcher} with increasing offsets until a short or empty page marks the end, and returns
 * all pages concatenated in fetch order. Does not deduplicate.
 */
public class PaginatedExtractor implements Extractor {
    private static final Logger log = LoggerFactory.getLogger(PaginatedExtractor.class);

    private final String name;
    private final PageFetcher fetcher;
    private final int batchSize;
    private final int maxPages;
    private final long pauseMillis;
    private final Counter pages;

    /**
     * @param maxPages    most pages that may carry data, 0 for none; one extra call checks that the source ended
     * @param pauseMillis pause between page calls
     */
    public PaginatedExtractor(String name, PageFetcher fetcher, int batchSize, int maxPages, long pauseMillis, Metrics metrics) {
        this.name = Objects.requireNonNull(name, "name");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        if (batchSize < 1) throw new ConfigurationException("batch size must be >= 1, got " + batchSize);
        if (maxPages < 0) throw new ConfigurationException("max pages must be >= 0, got " + maxPages);
        this.batchSize = batchSize;
        this.maxPages = maxPages;
        this.pauseMillis = Math.max(0, pauseMillis);
        this.pages = metrics.counter("extract." + Metrics.sanitize(name) + ".pages");
    }

    public PaginatedExtractor(String name, PageFetcher fetcher, int batchSize) {
        this(name, fetcher, batchSize, 0, 100, Metrics.noop());
    }

    /** One-shot extraction without a pause between pages. */
    public static List<Record> extractAll(PageFetcher fetcher, TimeWindow window, int batchSize) throws Exception {
        return new PaginatedExtractor("paginated", fetcher, batchSize, 0, 0, Metrics.noop()).extract(window);
    }

    @Override
    public List<Record> extract(TimeWindow window) throws Exception {
        List<Record> all = new ArrayList<>();
        int offset = 0;
        int page = 0;
        while (true) {
            if (page > 0 && pauseMillis > 0) Thread.sleep(pauseMillis);
            List<Record> batch = fetcher.fetch(window, batchSize, offset);
            page++;
            pages.inc();
            if (batch == null || batch.isEmpty()) {
                log.debug("{}: no more data at offset {}", name, offset);
                break;
            }
            if (maxPages > 0 && page > maxPages) {
                throw new ExtractionException(name + ": page ceiling of " + maxPages + " exceeded, source still returned "
                        + batch.size() + " records at offset " + offset);
            }
            all.addAll(batch);
            log.debug("{}: page {} returned {} records (total {})", name, page, batch.size(), all.size());
            if (batch.size() < batchSize) break;
            offset += batchSize;
        }
        log.info("{}: extracted {} records in {} page(s)", name, all.size(), page);
        return all;
    }

    public String name() { return name; }
    public int batchSize() { return batchSize; }
}
