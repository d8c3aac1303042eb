package io.snapshots.financial;

import io.snapshots.backfill.BackfillWatermarkPolicy;
import io.snapshots.error.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SnapshotConfigTest {
    private static final List<String> PROPERTIES = List.of(
            "snapshots.jdbc.url", "snapshots.symbols", "snapshots.load.batch", "snapshots.lookback.hours",
            "snapshots.job.timeout.seconds", "snapshots.job.retries", "snapshots.watermark.file",
            "snapshots.backfill.watermark", "snapshots.cmc.api.key", "snapshots.listings.max.pages",
            "snapshots.listings.pause.millis");

    @AfterEach
    void clearProperties() {
        PROPERTIES.forEach(System::clearProperty);
    }

    @Test
    void system_properties_override_defaults() {
        System.setProperty("snapshots.jdbc.url", "jdbc:h2:mem:cfg");
        System.setProperty("snapshots.symbols", "btc, eth,,BTC ,sol");
        System.setProperty("snapshots.load.batch", "50");
        System.setProperty("snapshots.lookback.hours", "6");
        System.setProperty("snapshots.job.timeout.seconds", "90");
        System.setProperty("snapshots.job.retries", "2");
        System.setProperty("snapshots.watermark.file", "/tmp/wm.json");
        System.setProperty("snapshots.backfill.watermark", "advance_if_newer");
        System.setProperty("snapshots.cmc.api.key", "k-123");
        System.setProperty("snapshots.listings.max.pages", "120");
        System.setProperty("snapshots.listings.pause.millis", "250");

        SnapshotConfig c = SnapshotConfig.fromEnv();

        assertEquals("jdbc:h2:mem:cfg", c.jdbcUrl());
        assertEquals(List.of("BTC", "ETH", "SOL"), c.symbols());
        assertEquals(50, c.loadBatchSize());
        assertEquals(Duration.ofHours(6), c.lookback());
        assertEquals(Duration.ofSeconds(90), c.jobTimeout());
        assertEquals(2, c.jobRetries());
        assertEquals(Path.of("/tmp/wm.json"), c.watermarkFile());
        assertEquals(BackfillWatermarkPolicy.ADVANCE_IF_NEWER, c.backfillWatermarkPolicy());
        assertEquals("k-123", c.requireApiKey());
        assertEquals(120, c.listingsMaxPages());
        assertEquals(250L, c.listingsPagePauseMillis());
    }

    @Test
    void non_numeric_setting_names_the_variable() {
        System.setProperty("snapshots.job.retries", "three");

        ConfigurationException e = assertThrows(ConfigurationException.class, SnapshotConfig::fromEnv);

        assertTrue(e.getMessage().contains("SNAPSHOTS_JOB_RETRIES"));
        assertTrue(e.getMessage().contains("three"));
    }

    @Test
    void listings_ceiling_defaults_above_a_full_listing() {
        SnapshotConfig c = SnapshotConfig.fromEnv();

        assertTrue((long) c.listingsMaxPages() * c.pageSize() > 10_000);
    }

    @Test
    void blank_api_key_is_rejected_only_when_required() {
        System.setProperty("snapshots.cmc.api.key", "  ");

        SnapshotConfig c = SnapshotConfig.fromEnv();

        assertFalse(c.hasApiKey());
        assertThrows(ConfigurationException.class, c::requireApiKey);
    }

    @Test
    void unknown_backfill_policy_fails_fast() {
        System.setProperty("snapshots.backfill.watermark", "sometimes");

        ConfigurationException e = assertThrows(ConfigurationException.class, SnapshotConfig::fromEnv);

        assertTrue(e.getMessage().contains("sometimes"));
    }
}
