package io.snapshots.financial;

import java.util.List;

/**
 * Raw access to the CoinMarketCap REST API. Implementations return the JSON response body.
 */
public interface CoinMarketCapClient {
    /** {@code /cryptocurrency/quotes/latest} for the given symbols, converted to USD. */
    String quotesLatest(List<String> symbols) throws Exception;

    /** {@code /cryptocurrency/listings/latest}; {@code start} is 1-based. */
    String listingsLatest(int start, int limit) throws Exception;
}
