package io.snapshots.financial;

import io.snapshots.backfill.BackfillWatermarkPolicy;
import io.snapshots.error.ConfigurationException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public record SnapshotConfig(
        String jdbcUrl,
        String jdbcUser,
        String jdbcPassword,
        String cmcApiKey,
        String cmcBaseUrl,
        List<String> symbols,
        int loadBatchSize,
        int pageSize,
        int listingsMaxPages,
        long listingsPagePauseMillis,
        Duration lookback,
        Duration jobTimeout,
        int jobRetries,
        Path watermarkFile,
        BackfillWatermarkPolicy backfillWatermarkPolicy
) {
    public static final String DEFAULT_CMC_BASE_URL = "https://pro-api.coinmarketcap.com/v1";

    public static SnapshotConfig fromEnv() {
        String url = setting("snapshots.jdbc.url", "SNAPSHOTS_JDBC_URL", "jdbc:h2:file:./data/snapshots");
        String user = setting("snapshots.jdbc.user", "SNAPSHOTS_JDBC_USER", null);
        String password = setting("snapshots.jdbc.password", "SNAPSHOTS_JDBC_PASSWORD", null);
        String apiKey = setting("snapshots.cmc.api.key", "CMC_API_KEY", "");
        String baseUrl = setting("snapshots.cmc.base.url", "CMC_BASE_URL", DEFAULT_CMC_BASE_URL);
        List<String> symbols = parseSymbols(setting("snapshots.symbols", "SYMBOLS", "BTC,ETH,SOL"));
        int batch = intSetting("snapshots.load.batch", "SNAPSHOTS_LOAD_BATCH", "500");
        int page = intSetting("snapshots.page.size", "SNAPSHOTS_PAGE_SIZE", "100");
        int maxPages = intSetting("snapshots.listings.max.pages", "SNAPSHOTS_LISTINGS_MAX_PAGES", "200");
        long pause = longSetting("snapshots.listings.pause.millis", "SNAPSHOTS_LISTINGS_PAUSE_MILLIS", "2000");
        Duration lookback = Duration.ofHours(longSetting("snapshots.lookback.hours", "SNAPSHOTS_LOOKBACK_HOURS", "1"));
        Duration timeout = Duration.ofSeconds(longSetting("snapshots.job.timeout.seconds", "SNAPSHOTS_JOB_TIMEOUT_SECONDS", "3600"));
        int retries = intSetting("snapshots.job.retries", "SNAPSHOTS_JOB_RETRIES", "0");
        Path watermarks = Path.of(setting("snapshots.watermark.file", "SNAPSHOTS_WATERMARK_FILE", "./data/watermarks.json"));
        BackfillWatermarkPolicy policy = policy(setting("snapshots.backfill.watermark", "SNAPSHOTS_BACKFILL_WATERMARK", "IGNORE"));
        return new SnapshotConfig(url, user, password, apiKey, baseUrl, symbols, batch, page, maxPages, pause, lookback, timeout, retries, watermarks, policy);
    }

    public boolean hasApiKey() { return cmcApiKey != null && !cmcApiKey.isBlank(); }

    public String requireApiKey() {
        if (!hasApiKey()) throw new ConfigurationException("CMC_API_KEY is not configured");
        return cmcApiKey;
    }

    static List<String> parseSymbols(String csv) {
        return Arrays.stream(csv.split(","))
                .map(s -> s.trim().toUpperCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    static BackfillWatermarkPolicy policy(String value) {
        try {
            return BackfillWatermarkPolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown backfill watermark policy '" + value + "', expected one of "
                    + Arrays.toString(BackfillWatermarkPolicy.values()), e);
        }
    }

    private static int intSetting(String property, String env, String def) {
        String value = setting(property, env, def);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw notANumber(property, env, value, e);
        }
    }

    private static long longSetting(String property, String env, String def) {
        String value = setting(property, env, def);
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw notANumber(property, env, value, e);
        }
    }

    private static ConfigurationException notANumber(String property, String env, String value, Exception cause) {
        return new ConfigurationException(env + " (" + property + ") must be a whole number, got '" + value + "'", cause);
    }

    private static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
