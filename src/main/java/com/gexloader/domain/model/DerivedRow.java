package com.gexloader.domain.model;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * A strike row ready to persist. Keyed by (ticker, tradeDate, expirDate, strike) where
 * {@code tradeDate} is the stored date of the run, not the provider's session date.
 */
@Data
@Builder
public class DerivedRow {

    private String ticker;
    private LocalDate tradeDate;
    private LocalDate expirDate;

    /** Days from the stored date to expiration. */
    private Integer dte;

    private Double strike;
    private Double stockPrice;
    private Integer callOi;
    private Integer putOi;
    private Double gamma;
    private Double gexCall;
    private Double gexPut;
    private Double shortRate;
    private Double divYield;

    /** strike * exp((shortRate - divYield) * t); null when any input is missing. */
    private Double discountedStrike;

    public boolean isKeyed() {
        return ticker != null && tradeDate != null && expirDate != null && strike != null;
    }
}
