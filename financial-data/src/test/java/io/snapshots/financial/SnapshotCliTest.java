package io.snapshots.financial;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.snapshots.backfill.BackfillWatermarkPolicy;
import io.snapshots.jobs.JobRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotCliTest {
    @TempDir
    Path tmp;

    private final FakeCmcClient client = new FakeCmcClient().price("BTC", "64000").price("ETH", "3000");
    private Injector injector;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setup() {
        String url = "jdbc:h2:mem:cli_" + UUID.randomUUID().toString().replace("-", "") + ";DB_CLOSE_DELAY=-1";
        SnapshotConfig config = new SnapshotConfig(url, null, null, "", SnapshotConfig.DEFAULT_CMC_BASE_URL,
                List.of("BTC", "ETH"), 100, 100, 200, 0, Duration.ofHours(1), Duration.ofMinutes(1), 0,
                tmp.resolve("watermarks.json"), BackfillWatermarkPolicy.IGNORE);
        injector = Guice.createInjector(new MarketDataModule(config, client));
    }

    @AfterEach
    void close() {
        injector.getInstance(JobRegistry.class).close();
    }

    private int execute(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cmd = SnapshotCli.commandLine(injector);
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void list_prints_every_job() {
        assertEquals(0, execute("list"));

        String text = out.toString();
        assertTrue(text.contains("cmc_prices_hourly"));
        assertTrue(text.contains("cmc_listings_daily"));
        assertTrue(text.contains("never"));
    }

    @Test
    void crontab_uses_launcher_and_log() {
        assertEquals(0, execute("crontab", "--launcher", "/opt/run.sh", "--log", "/var/log/snap.log"));

        assertTrue(out.toString().contains("*/15 * * * * /opt/run.sh run cmc_latest_quotes >> /var/log/snap.log 2>&1"));
    }

    @Test
    void run_loads_and_persists_watermark() throws Exception {
        assertEquals(0, execute("run", "cmc_latest_quotes"));

        assertTrue(Files.exists(tmp.resolve("watermarks.json")));
        assertTrue(Files.readString(tmp.resolve("watermarks.json")).contains("cmc_latest_quotes"));
        assertEquals(1, client.quoteRequests.size());
    }

    @Test
    void unknown_job_exits_non_zero() {
        assertEquals(1, execute("run", "nope"));
        assertTrue(client.quoteRequests.isEmpty());
    }

    @Test
    void backfill_rejects_bad_arguments() {
        assertEquals(2, execute("backfill", "cmc_prices_daily", "--days", "1", "--step-hours", "0"));
        assertTrue(err.toString().contains("--step-hours"));
        assertTrue(client.quoteRequests.isEmpty());
    }

    @Test
    void backfill_runs_one_slice_per_day() {
        assertEquals(0, execute("backfill", "cmc_prices_daily", "--days", "2"));

        assertEquals(3, client.quoteRequests.size());
    }

    @Test
    void init_schema_and_compact_report_counts() {
        assertEquals(0, execute("init-schema"));
        assertTrue(out.toString().contains("Created 5 table(s)"));

        assertEquals(0, execute("compact"));
        assertTrue(out.toString().contains("Removed 0 superseded row(s)"));
    }
}
