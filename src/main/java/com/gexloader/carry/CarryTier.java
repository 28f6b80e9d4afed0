package com.gexloader.carry;

import com.gexloader.domain.model.CarryRate;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Precedence tiers for resolving (shortRate, divYield) of one expiration, in the order
 * they are consulted. Dividend yields are sparse for some expirations, so the yield
 * drives which tier wins; the short rate is back-filled from whatever source has one.
 */
public enum CarryTier {

    /** Primary ticker quote with a non-zero yield. */
    PRIMARY {
        @Override
        public Optional<CarryRate> resolve(LocalDate expiration, CarryInputs inputs) {
            return inputs.getPrimary()
                    .rateFor(expiration)
                    .filter(CarryRate::hasYield)
                    .map(quote -> new CarryRate(
                            quote.getShortRate() != null ? quote.getShortRate() : inputs.firstRate(expiration),
                            quote.getDivYield()));
        }
    },

    /** Proxy ticker yield combined with the primary or proxy rate. */
    PROXY {
        @Override
        public Optional<CarryRate> resolve(LocalDate expiration, CarryInputs inputs) {
            return inputs.getProxy()
                    .rateFor(expiration)
                    .filter(CarryRate::hasYield)
                    .map(quote -> new CarryRate(inputs.firstRate(expiration), quote.getDivYield()));
        }
    },

    /** Scalar fallback rate with zero yield. Always produces a value. */
    FALLBACK {
        @Override
        public Optional<CarryRate> resolve(LocalDate expiration, CarryInputs inputs) {
            return Optional.of(new CarryRate(inputs.getFallbackRate(), 0.0));
        }
    };

    public abstract Optional<CarryRate> resolve(LocalDate expiration, CarryInputs inputs);
}
