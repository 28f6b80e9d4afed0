package com.gexloader.provider;

import com.gexloader.domain.model.CarryQuote;
import com.gexloader.domain.model.StrikeRecord;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the end-of-day options data provider. Every component that needs
 * provider data goes through this interface.
 *
 * <p>Failure classification is shared by all implementations:
 * <ul>
 *   <li>HTTP 401 on any endpoint: {@link com.gexloader.exception.AuthenticationException}</li>
 *   <li>other errors from the strikes endpoint: {@link com.gexloader.exception.FetchException}</li>
 *   <li>errors from carry and rate endpoints: swallowed into an empty result, the next
 *       source in the chain is tried</li>
 * </ul>
 */
public interface MarketDataClient {

    /**
     * Lightweight existence check for a session.
     *
     * @return true if the provider reports at least one strike for the ticker on that date
     * @throws com.gexloader.exception.AuthenticationException if the token is rejected
     */
    boolean probeHasData(String ticker, LocalDate tradeDate);

    /**
     * Downloads the full strike snapshot, dropping records beyond the configured DTE limit.
     *
     * @throws com.gexloader.exception.FetchException if the provider returns an error
     */
    List<StrikeRecord> fetchStrikes(String ticker, LocalDate tradeDate);

    /**
     * Per-expiration short rates and dividend yields. Tries the historical endpoint and
     * falls back to the live one when it errors or is empty.
     *
     * @return the quotes, possibly empty; never null
     */
    CarryQuote fetchCarryQuotes(String ticker, LocalDate tradeDate);

    /**
     * Scalar short rate used when no per-expiration quote exists. Same historical-then-live chain.
     */
    Optional<Double> fetchFallbackRate(String ticker, LocalDate tradeDate);
}
