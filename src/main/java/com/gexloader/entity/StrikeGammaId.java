package com.gexloader.entity;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Composite key of {@link StrikeGammaEntity}: (ticker, trade_date, expir_date, strike).
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class StrikeGammaId implements Serializable {

    private String ticker;
    private LocalDate tradeDate;
    private LocalDate expirDate;
    private BigDecimal strike;
}
