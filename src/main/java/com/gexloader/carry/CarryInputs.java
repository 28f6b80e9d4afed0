package com.gexloader.carry;

import com.gexloader.domain.model.CarryQuote;
import java.time.LocalDate;
import java.util.Optional;
import lombok.Getter;
import lombok.ToString;

/**
 * Carry sources gathered for one run: quotes for the primary and proxy tickers and the
 * scalar fallback short rate (null when no source reported one).
 */
@Getter
@ToString
public class CarryInputs {

    private final CarryQuote primary;
    private final CarryQuote proxy;
    private final Double fallbackRate;

    public CarryInputs(CarryQuote primary, CarryQuote proxy, Double fallbackRate) {
        this.primary = primary != null ? primary : CarryQuote.empty(null, null);
        this.proxy = proxy != null ? proxy : CarryQuote.empty(null, null);
        this.fallbackRate = fallbackRate;
    }

    /** First non-null short rate among primary quote, proxy quote, scalar fallback. */
    public Double firstRate(LocalDate expiration) {
        return FirstMatch.<Double>of(
                        () -> primary.rateFor(expiration).map(r -> r.getShortRate()),
                        () -> proxy.rateFor(expiration).map(r -> r.getShortRate()),
                        () -> Optional.ofNullable(fallbackRate))
                .resolve()
                .orElse(null);
    }
}
