package com.gexloader.pipeline;

import com.gexloader.calendar.ResolvedDates;
import com.gexloader.calendar.TradeDateResolver;
import com.gexloader.carry.CarryInputs;
import com.gexloader.carry.CarryRateReconciler;
import com.gexloader.carry.ResolvedCarry;
import com.gexloader.config.JobConfig;
import com.gexloader.domain.model.CarryQuote;
import com.gexloader.domain.model.CarryRate;
import com.gexloader.domain.model.DerivedRow;
import com.gexloader.domain.model.RunResult;
import com.gexloader.domain.model.StrikeRecord;
import com.gexloader.observability.JobMetrics;
import com.gexloader.provider.MarketDataClient;
import com.gexloader.service.AggregateViewRefresher;
import com.gexloader.service.SnapshotStore;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * End-of-day snapshot pipeline: resolve dates, fetch strikes and carry, reconcile carry,
 * derive rows, replace the stored-date partition, refresh the aggregate.
 *
 * <p>Runs sequentially on the calling thread. Every fatal condition (auth, no source
 * date, strike fetch failure) is raised before the write, so a partition is either fully
 * replaced or not touched at all. An empty snapshot ends the run without writing.
 */
@Service
public class EodSnapshotJob {

    private static final Logger log = LoggerFactory.getLogger(EodSnapshotJob.class);

    private final TradeDateResolver tradeDateResolver;
    private final MarketDataClient marketDataClient;
    private final CarryRateReconciler carryRateReconciler;
    private final RowBuilder rowBuilder;
    private final SnapshotStore snapshotStore;
    private final AggregateViewRefresher aggregateViewRefresher;
    private final JobConfig jobConfig;
    private final JobMetrics jobMetrics;

    public EodSnapshotJob(
            TradeDateResolver tradeDateResolver,
            MarketDataClient marketDataClient,
            CarryRateReconciler carryRateReconciler,
            RowBuilder rowBuilder,
            SnapshotStore snapshotStore,
            AggregateViewRefresher aggregateViewRefresher,
            JobConfig jobConfig,
            JobMetrics jobMetrics) {
        this.tradeDateResolver = tradeDateResolver;
        this.marketDataClient = marketDataClient;
        this.carryRateReconciler = carryRateReconciler;
        this.rowBuilder = rowBuilder;
        this.snapshotStore = snapshotStore;
        this.aggregateViewRefresher = aggregateViewRefresher;
        this.jobConfig = jobConfig;
        this.jobMetrics = jobMetrics;
    }

    /**
     * Runs the pipeline once.
     *
     * @param storedOverride explicit stored date, or null
     * @param sourceOverride explicit source date, or null
     */
    public RunResult run(LocalDate storedOverride, LocalDate sourceOverride) {
        long startTime = System.currentTimeMillis();
        String ticker = jobConfig.getTicker();

        ResolvedDates dates = tradeDateResolver.resolve(storedOverride, sourceOverride);
        LocalDate sourceDate = dates.getSourceDate();
        LocalDate storedDate = dates.getStoredDate();

        log.info("Fetching ORATS EOD strikes for {} {} (stored as {})", ticker, sourceDate, storedDate);
        List<StrikeRecord> records = marketDataClient.fetchStrikes(ticker, sourceDate);
        RunResult.RunResultBuilder result = RunResult.builder()
                .ticker(ticker)
                .sourceDate(sourceDate)
                .storedDate(storedDate)
                .fetched(records.size());

        if (records.isEmpty()) {
            log.warn("No records returned for {} {}, nothing written", ticker, sourceDate);
            return finish(result.outcome(RunResult.Outcome.NO_DATA), startTime);
        }

        Map<LocalDate, ResolvedCarry> carry = reconcileCarry(ticker, sourceDate, records);

        List<DerivedRow> rows = new ArrayList<>(records.size());
        int dropped = 0;
        for (StrikeRecord record : records) {
            try {
                DerivedRow row = rowBuilder.build(record, storedDate, carryFor(carry, record));
                if (!row.isKeyed()) {
                    log.warn("Dropping record without expiration or strike: {}", record);
                    dropped++;
                    continue;
                }
                rows.add(row);
            } catch (RuntimeException e) {
                log.error("Row build failure for record: {}", record, e);
                dropped++;
            }
        }
        result.dropped(dropped);

        if (rows.isEmpty()) {
            log.warn("Nothing to insert for {} {}", ticker, storedDate);
            return finish(result.outcome(RunResult.Outcome.NO_DATA), startTime);
        }

        int written = snapshotStore.replacePartition(ticker, storedDate, rows);
        aggregateViewRefresher.refresh();

        log.info("Upserted {} rows for {} {} (source {})", written, ticker, storedDate, sourceDate);
        return finish(result.outcome(RunResult.Outcome.WRITTEN).written(written), startTime);
    }

    private Map<LocalDate, ResolvedCarry> reconcileCarry(String ticker, LocalDate sourceDate, List<StrikeRecord> records) {
        CarryQuote primary = marketDataClient.fetchCarryQuotes(ticker, sourceDate);
        CarryQuote proxy = marketDataClient.fetchCarryQuotes(jobConfig.getProxyTicker(), sourceDate);
        Double fallbackRate = marketDataClient.fetchFallbackRate(ticker, sourceDate).orElse(null);

        List<LocalDate> expirations = records.stream()
                .map(r -> RowBuilder.parseDate(r.getExpirDate()))
                .toList();
        Map<LocalDate, ResolvedCarry> carry =
                carryRateReconciler.reconcile(expirations, new CarryInputs(primary, proxy, fallbackRate));
        jobMetrics.recordCarry(carry.values());
        return carry;
    }

    private static CarryRate carryFor(Map<LocalDate, ResolvedCarry> carry, StrikeRecord record) {
        LocalDate expiration = RowBuilder.parseDate(record.getExpirDate());
        ResolvedCarry resolved = expiration != null ? carry.get(expiration) : null;
        return resolved != null ? resolved.getRate() : null;
    }

    private RunResult finish(RunResult.RunResultBuilder builder, long startTime) {
        RunResult result = builder.durationMs(System.currentTimeMillis() - startTime).build();
        jobMetrics.recordRun(result);
        log.info(
                "Run finished: ticker={}, source={}, stored={}, outcome={}, fetched={}, dropped={}, written={}, {}ms",
                result.getTicker(),
                result.getSourceDate(),
                result.getStoredDate(),
                result.getOutcome(),
                result.getFetched(),
                result.getDropped(),
                result.getWritten(),
                result.getDurationMs());
        return result;
    }
}
