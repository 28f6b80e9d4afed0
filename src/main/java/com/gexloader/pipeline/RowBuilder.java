package com.gexloader.pipeline;

import com.gexloader.config.JobConfig;
import com.gexloader.domain.model.CarryRate;
import com.gexloader.domain.model.DerivedRow;
import com.gexloader.domain.model.StrikeRecord;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

/**
 * Turns a provider strike record into a persistable row.
 *
 * <p>Formulas:
 * <pre>
 * gex(side)          = gamma * stockPrice^2 * openInterest(side) * contractMultiplier
 * dte                = days(storedDate, expirDate), or the provider dte if expirDate does not parse
 * discountedStrike   = strike * exp((shortRate - divYield) * (dte + 1) / 252)
 * </pre>
 *
 * <p>Every row is stamped with the configured ticker and the run's stored date rather
 * than the provider's session date, and DTE is recomputed against the stored date.
 */
@Component
public class RowBuilder {

    static final double TRADING_DAYS_PER_YEAR = 252.0;

    private final JobConfig jobConfig;

    public RowBuilder(JobConfig jobConfig) {
        this.jobConfig = jobConfig;
    }

    /**
     * Builds the row for one record.
     *
     * @param record     provider record
     * @param storedDate date the snapshot is recorded under
     * @param carry      resolved carry for the record's expiration, or null if none
     */
    public DerivedRow build(StrikeRecord record, LocalDate storedDate, CarryRate carry) {
        double multiplier = jobConfig.getContractMultiplier();
        LocalDate expiration = parseDate(record.getExpirDate());
        Integer dte = effectiveDte(expiration, storedDate, record.getDte());
        Double shortRate = carry != null ? carry.getShortRate() : null;
        Double divYield = carry != null ? carry.getDivYield() : null;

        return DerivedRow.builder()
                .ticker(jobConfig.getTicker())
                .tradeDate(storedDate)
                .expirDate(expiration)
                .dte(dte)
                .strike(record.getStrike())
                .stockPrice(record.getStockPrice())
                .callOi(record.getCallOpenInterest())
                .putOi(record.getPutOpenInterest())
                .gamma(record.getGamma())
                .gexCall(gammaExposure(record.getGamma(), record.getStockPrice(), record.getCallOpenInterest(), multiplier))
                .gexPut(gammaExposure(record.getGamma(), record.getStockPrice(), record.getPutOpenInterest(), multiplier))
                .shortRate(shortRate)
                .divYield(divYield)
                .discountedStrike(discountedStrike(record.getStrike(), dte, shortRate, divYield))
                .build();
    }

    /** Gamma exposure of one side; missing inputs count as zero. */
    public static double gammaExposure(Double gamma, Double stockPrice, Integer openInterest, double multiplier) {
        double g = gamma != null ? gamma : 0.0;
        double s = stockPrice != null ? stockPrice : 0.0;
        double oi = openInterest != null ? openInterest : 0;
        return g * s * s * oi * multiplier;
    }

    /** Days from the stored date to expiration, or the provider value when expiration is unknown. */
    public static Integer effectiveDte(LocalDate expiration, LocalDate storedDate, Integer providerDte) {
        if (expiration == null || storedDate == null) {
            return providerDte;
        }
        return (int) ChronoUnit.DAYS.between(storedDate, expiration);
    }

    /** Carry-adjusted strike level; null when any input is missing. */
    public static Double discountedStrike(Double strike, Integer dte, Double shortRate, Double divYield) {
        if (strike == null || dte == null || shortRate == null || divYield == null) {
            return null;
        }
        double t = (dte + 1) / TRADING_DAYS_PER_YEAR;
        return strike * Math.exp((shortRate - divYield) * t);
    }

    static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
