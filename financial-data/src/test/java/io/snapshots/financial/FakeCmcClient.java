package io.snapshots.financial;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/** Serves canned CMC JSON built from a symbol-to-price map and records every request. */
final class FakeCmcClient implements CoinMarketCapClient {
    final Map<String, BigDecimal> prices = new LinkedHashMap<>();
    final List<List<String>> quoteRequests = Collections.synchronizedList(new ArrayList<>());
    final List<int[]> listingRequests = Collections.synchronizedList(new ArrayList<>());
    volatile String quotesOverride;

    FakeCmcClient price(String symbol, String price) {
        prices.put(symbol, new BigDecimal(price));
        return this;
    }

    @Override
    public String quotesLatest(List<String> symbols) {
        quoteRequests.add(List.copyOf(symbols));
        if (quotesOverride != null) return quotesOverride;
        StringJoiner data = new StringJoiner(",", "{", "}");
        int id = 1;
        for (String s : symbols) {
            BigDecimal p = prices.get(s);
            if (p != null) data.add("\"" + s + "\":" + coin(id, s, p));
            id++;
        }
        return envelope(data.toString());
    }

    @Override
    public String listingsLatest(int start, int limit) {
        listingRequests.add(new int[]{start, limit});
        List<String> all = new ArrayList<>();
        int id = 1;
        for (Map.Entry<String, BigDecimal> e : prices.entrySet()) all.add(coin(id++, e.getKey(), e.getValue()));
        StringJoiner data = new StringJoiner(",", "[", "]");
        for (int i = start - 1; i < Math.min(all.size(), start - 1 + limit); i++) data.add(all.get(i));
        return envelope(data.toString());
    }

    static String envelope(String data) {
        return "{\"status\":{\"error_code\":0,\"error_message\":null},\"data\":" + data + "}";
    }

    static String coin(int id, String symbol, BigDecimal price) {
        return "{\"id\":" + id + ",\"symbol\":\"" + symbol + "\",\"name\":\"" + symbol.toLowerCase() + " coin\","
                + "\"slug\":\"" + symbol.toLowerCase() + "\",\"cmc_rank\":" + id + ",\"num_market_pairs\":100,"
                + "\"circulating_supply\":19000000,\"total_supply\":21000000,\"max_supply\":null,"
                + "\"tags\":[\"mineable\",{\"slug\":\"pow\",\"name\":\"PoW\"}],"
                + "\"date_added\":\"2013-04-28T00:00:00.000Z\","
                + "\"quote\":{\"USD\":{\"price\":" + price.toPlainString() + ",\"volume_24h\":123456.5,"
                + "\"market_cap\":987654321.25,\"percent_change_1h\":0.1,\"percent_change_24h\":-1.5,"
                + "\"percent_change_7d\":3.25,\"last_updated\":\"2024-05-10T12:29:00.000Z\"}}}";
    }
}
