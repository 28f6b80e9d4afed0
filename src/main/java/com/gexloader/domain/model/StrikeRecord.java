package com.gexloader.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One strike of the provider's end-of-day snapshot, as returned by the strikes endpoint.
 *
 * <p>Field names follow the ORATS JSON projection. Dates stay as text because the
 * provider occasionally returns values that do not parse; the row builder decides
 * what to do with them. Every numeric field may be null.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class StrikeRecord {

    private String ticker;

    /** Session the provider snapshot describes (the source date). */
    private String tradeDate;

    private String expirDate;

    /** Provider's days-to-expiration, relative to the source date. */
    private Integer dte;

    private Double strike;

    private Double stockPrice;

    private Integer callOpenInterest;

    private Integer putOpenInterest;

    /** Per-option gamma; ORATS reports the same value for the call and the put. */
    private Double gamma;
}
