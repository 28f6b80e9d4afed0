package com.gexloader.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * JPA entity for the orats_oi_gamma table.
 * One row per (ticker, stored trade date, expiration, strike). A stored date's rows are
 * only ever replaced as a whole, so entities are always new when saved.
 */
@Entity
@Table(name = "orats_oi_gamma")
@IdClass(StrikeGammaId.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StrikeGammaEntity implements Persistable<StrikeGammaId> {

    @Id
    @Column(nullable = false)
    private String ticker;

    @Id
    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Id
    @Column(name = "expir_date", nullable = false)
    private LocalDate expirDate;

    @Id
    @Column(precision = 14, scale = 4, nullable = false)
    private BigDecimal strike;

    private Integer dte;

    @Column(name = "stock_price", precision = 16, scale = 6)
    private BigDecimal stockPrice;

    @Column(name = "call_oi")
    private Integer callOi;

    @Column(name = "put_oi")
    private Integer putOi;

    private Double gamma;

    @Column(name = "gex_call")
    private Double gexCall;

    @Column(name = "gex_put")
    private Double gexPut;

    @Column(name = "short_rate")
    private Double shortRate;

    @Column(name = "div_yield")
    private Double divYield;

    @Column(name = "discounted_strike")
    private Double discountedStrike;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    @Override
    public StrikeGammaId getId() {
        return new StrikeGammaId(ticker, tradeDate, expirDate, strike);
    }

    @Override
    public boolean isNew() {
        return true;
    }
}
