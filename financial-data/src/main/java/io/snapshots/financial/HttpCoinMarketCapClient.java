package io.snapshots.financial;

import io.snapshots.error.ConfigurationException;
import io.snapshots.error.ExtractionException;
import io.snapshots.retry.ExponentialBackoffRetryPolicy;
import io.snapshots.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

final class HttpCoinMarketCapClient implements CoinMarketCapClient {
    private static final Logger log = LoggerFactory.getLogger(HttpCoinMarketCapClient.class);

    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
    private final String baseUrl;
    private final String apiKey;
    private final RetryPolicy retry;

    HttpCoinMarketCapClient(String baseUrl, String apiKey) {
        this(baseUrl, apiKey, new ExponentialBackoffRetryPolicy(3, 1_000, 8_000));
    }

    HttpCoinMarketCapClient(String baseUrl, String apiKey, RetryPolicy retry) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.retry = retry;
    }

    @Override
    public String quotesLatest(List<String> symbols) throws Exception {
        return get("/cryptocurrency/quotes/latest?symbol=" + encode(String.join(",", symbols)) + "&convert=USD");
    }

    @Override
    public String listingsLatest(int start, int limit) throws Exception {
        return get("/cryptocurrency/listings/latest?start=" + start + "&limit=" + limit + "&convert=USD");
    }

    private String get(String pathAndQuery) throws Exception {
        if (apiKey == null || apiKey.isBlank()) throw new ConfigurationException("CMC_API_KEY is not configured");
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + pathAndQuery))
                .header("X-CMC_PRO_API_KEY", apiKey)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();
        int attempt = 0;
        while (true) {
            attempt++;
            Exception failure;
            try {
                HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
                int status = resp.statusCode();
                if (status == 200) return resp.body();
                String msg = "CMC API error " + status + " for " + pathAndQuery + ": " + abbreviate(resp.body());
                if (status != 429 && status < 500) throw new ExtractionException(msg);
                failure = new ExtractionException(msg);
            } catch (IOException e) {
                failure = e;
            }
            if (!retry.shouldRetry(attempt, failure)) {
                if (failure instanceof ExtractionException ee) throw ee;
                throw new ExtractionException("CMC request " + pathAndQuery + " failed after " + attempt + " attempt(s)", failure);
            }
            long backoff = retry.backoffMillis(attempt);
            log.warn("CMC request {} attempt {} failed ({}), retrying in {} ms", pathAndQuery, attempt, failure.getMessage(), backoff);
            Thread.sleep(backoff);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) return "";
        return body.length() > 300 ? body.substring(0, 300) + "..." : body;
    }
}
