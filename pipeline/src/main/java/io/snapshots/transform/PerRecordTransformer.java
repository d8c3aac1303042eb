package io.snapshots.transform;

import com.codahale.metrics.Counter;
import io.snapshots.core.Record;
import io.snapshots.core.Transformer;
import io.snapshots.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a {@link RecordFunction} to each record. A record whose function throws is dropped and counted;
 * the rest of the batch continues.
 */
public class PerRecordTransformer implements Transformer {
    private static final Logger log = LoggerFactory.getLogger(PerRecordTransformer.class);

    private final String name;
    private final RecordFunction fn;
    private final Counter dropped;
    private final Counter failed;

    public PerRecordTransformer(String name, RecordFunction fn, Metrics metrics) {
        this.name = name;
        this.fn = fn;
        this.dropped = metrics.counter("transform." + Metrics.sanitize(name) + ".dropped");
        this.failed = metrics.counter("transform." + Metrics.sanitize(name) + ".failed");
    }

    @Override
    public List<Record> transform(List<Record> records) {
        List<Record> out = new ArrayList<>(records.size());
        int skipped = 0;
        for (int i = 0; i < records.size(); i++) {
            Record in = records.get(i);
            try {
                Record r = fn.apply(in);
                if (r == null) {
                    skipped++;
                    dropped.inc();
                } else {
                    out.add(r);
                }
            } catch (Exception e) {
                skipped++;
                failed.inc();
                log.warn("{}: dropping record {}: {}", name, i, e.getMessage());
            }
        }
        log.debug("{}: transformed {} records into {} (skipped {})", name, records.size(), out.size(), skipped);
        return out;
    }
}
