package com.gexloader.domain.model;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Per-expiration carry observations for one ticker on one source date.
 */
@Getter
@ToString
public class CarryQuote {

    private final String ticker;
    private final LocalDate sourceDate;
    private final Map<LocalDate, CarryRate> byExpiration;

    public CarryQuote(String ticker, LocalDate sourceDate, Map<LocalDate, CarryRate> byExpiration) {
        this.ticker = ticker;
        this.sourceDate = sourceDate;
        this.byExpiration = byExpiration != null ? Map.copyOf(byExpiration) : Map.of();
    }

    public static CarryQuote empty(String ticker, LocalDate sourceDate) {
        return new CarryQuote(ticker, sourceDate, Map.of());
    }

    public Optional<CarryRate> rateFor(LocalDate expiration) {
        if (expiration == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExpiration.get(expiration));
    }

    public boolean isEmpty() {
        return byExpiration.isEmpty();
    }

    public int size() {
        return byExpiration.size();
    }
}
