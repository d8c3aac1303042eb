package io.snapshots.financial;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.snapshots.core.Record;
import io.snapshots.error.ExtractionException;

import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Flattens CoinMarketCap JSON responses into records, one per coin, with the USD quote fields lifted to the top
 * level. Missing fields stay null; shaping and validation happen in {@link QuoteTransformer}.
 */
final class CmcResponses {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private CmcResponses() {}

    /** quotes/latest: {@code data} maps symbol to one coin (v1) or to a list of coins (v2). */
    static List<Record> parseQuotes(String body) {
        JsonNode data = dataOf(body);
        List<Record> out = new ArrayList<>();
        if (!data.isObject()) return out;
        Iterator<Map.Entry<String, JsonNode>> it = data.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode coin = e.getValue().isArray() ? e.getValue().path(0) : e.getValue();
            if (coin.isMissingNode() || coin.isNull()) continue;
            out.add(toRecord(coin, e.getKey()));
        }
        return out;
    }

    /** listings/latest: {@code data} is a list of coins ordered by rank. */
    static List<Record> parseListings(String body) {
        JsonNode data = dataOf(body);
        List<Record> out = new ArrayList<>();
        if (!data.isArray()) return out;
        for (JsonNode coin : data) out.add(toRecord(coin, null));
        return out;
    }

    private static JsonNode dataOf(String body) {
        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (IOException e) {
            throw new ExtractionException("CMC response is not valid JSON", e);
        }
        JsonNode status = root.path("status");
        int code = status.path("error_code").asInt(0);
        if (code != 0) {
            throw new ExtractionException("CMC API returned error " + code + ": " + status.path("error_message").asText(""));
        }
        return root.path("data");
    }

    private static Record toRecord(JsonNode coin, String symbolKey) {
        JsonNode usd = coin.path("quote").path("USD");
        List<String> tags = new ArrayList<>();
        for (JsonNode t : coin.path("tags")) {
            tags.add(t.isObject() ? t.path("slug").asText() : t.asText());
        }
        return Record.builder()
                .put("cmc_id", number(coin.path("id")))
                .put("symbol", text(coin.path("symbol"), symbolKey))
                .put("name", text(coin.path("name"), null))
                .put("slug", text(coin.path("slug"), null))
                .put("cmc_rank", number(coin.path("cmc_rank")))
                .put("num_market_pairs", number(coin.path("num_market_pairs")))
                .put("circulating_supply", number(coin.path("circulating_supply")))
                .put("total_supply", number(coin.path("total_supply")))
                .put("max_supply", number(coin.path("max_supply")))
                .put("tags", tags)
                .put("date_added", instant(coin.path("date_added")))
                .put("price", number(usd.path("price")))
                .put("volume_24h", number(usd.path("volume_24h")))
                .put("market_cap", number(usd.path("market_cap")))
                .put("percent_change_1h", number(usd.path("percent_change_1h")))
                .put("percent_change_24h", number(usd.path("percent_change_24h")))
                .put("percent_change_7d", number(usd.path("percent_change_7d")))
                .put("last_updated", instant(usd.path("last_updated")))
                .build();
    }

    private static String text(JsonNode n, String fallback) {
        return n.isTextual() ? n.asText() : fallback;
    }

    private static Number number(JsonNode n) {
        return n.isNumber() ? n.numberValue() : null;
    }

    // CMC uses ISO-8601 with offset, e.g. 2024-05-10T12:31:00.000Z
    private static Instant instant(JsonNode n) {
        if (!n.isTextual()) return null;
        try {
            return OffsetDateTime.parse(n.asText()).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
