package com.gexloader.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Short rate and dividend yield for one expiration, both as decimals (0.05 = 5%).
 * Either component may be null when the source did not report it.
 */
@Data
@Builder
@AllArgsConstructor
public class CarryRate {

    private Double shortRate;
    private Double divYield;

    public boolean hasYield() {
        return divYield != null && divYield != 0.0;
    }
}
