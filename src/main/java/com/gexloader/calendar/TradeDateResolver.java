package com.gexloader.calendar;

import com.gexloader.config.JobConfig;
import com.gexloader.exception.NoSourceDateFoundException;
import com.gexloader.provider.MarketDataClient;
import java.time.Clock;
import java.time.LocalDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Decides which market session to query and which date to record it under.
 *
 * <p>The provider publishes a session after the close and the job normally runs the
 * next morning, so the stored date ("today") maps back to the most recent earlier
 * business day that actually has data. The backward search tolerates late publishing
 * and exchange holidays. Which date is stored is delegated to the configured
 * {@link StoredDatePolicy}.
 */
@Service
public class TradeDateResolver {

    private static final Logger log = LoggerFactory.getLogger(TradeDateResolver.class);

    private final BusinessDayCalendar businessDayCalendar;
    private final MarketDataClient marketDataClient;
    private final JobConfig jobConfig;
    private final Clock clock;

    public TradeDateResolver(
            BusinessDayCalendar businessDayCalendar,
            MarketDataClient marketDataClient,
            JobConfig jobConfig,
            Clock clock) {
        this.businessDayCalendar = businessDayCalendar;
        this.marketDataClient = marketDataClient;
        this.jobConfig = jobConfig;
        this.clock = clock;
    }

    /**
     * Resolves the date pair for this run.
     *
     * @param storedOverride explicit stored date, or null
     * @param sourceOverride explicit source date, or null
     * @throws NoSourceDateFoundException if a source date must be searched and none has data
     */
    public ResolvedDates resolve(LocalDate storedOverride, LocalDate sourceOverride) {
        LocalDate today = LocalDate.now(clock.withZone(jobConfig.zoneId()));
        ResolvedDates resolved = jobConfig.getDatePolicy()
                .resolve(today, storedOverride, sourceOverride, businessDayCalendar, this::findSourceDate);
        log.info(
                "Resolved dates: policy={}, today={}, source={}, stored={}",
                jobConfig.getDatePolicy(),
                today,
                resolved.getSourceDate(),
                resolved.getStoredDate());
        return resolved;
    }

    /**
     * Walks back one calendar day at a time from the day before {@code before}, probing
     * business days only, until one has data or the lookback window is spent.
     */
    public LocalDate findSourceDate(LocalDate before) {
        String ticker = jobConfig.getTicker();
        LocalDate candidate = before.minusDays(1);
        for (int attempt = 0; attempt < jobConfig.getLookbackDays(); attempt++) {
            if (businessDayCalendar.isBusinessDay(candidate)) {
                if (marketDataClient.probeHasData(ticker, candidate)) {
                    return candidate;
                }
                log.debug("No {} data for {}, stepping back", ticker, candidate);
            }
            candidate = candidate.minusDays(1);
        }
        throw new NoSourceDateFoundException(ticker, before, jobConfig.getLookbackDays());
    }
}
