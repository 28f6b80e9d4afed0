package com.gexloader.unit.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.gexloader.calendar.ResolvedDates;
import com.gexloader.calendar.TradeDateResolver;
import com.gexloader.carry.CarryRateReconciler;
import com.gexloader.config.JobConfig;
import com.gexloader.domain.model.CarryQuote;
import com.gexloader.domain.model.CarryRate;
import com.gexloader.domain.model.DerivedRow;
import com.gexloader.domain.model.RunResult;
import com.gexloader.domain.model.StrikeRecord;
import com.gexloader.exception.FetchException;
import com.gexloader.observability.JobMetrics;
import com.gexloader.pipeline.EodSnapshotJob;
import com.gexloader.pipeline.RowBuilder;
import com.gexloader.provider.MarketDataClient;
import com.gexloader.service.AggregateViewRefresher;
import com.gexloader.service.SnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for EodSnapshotJob. The provider, store and view refresher are mocked;
 * carry reconciliation, row building and metrics are real.
 */
@ExtendWith(MockitoExtension.class)
class EodSnapshotJobTest {

    private static final LocalDate FRIDAY = LocalDate.of(2025, 6, 13);
    private static final LocalDate MONDAY = LocalDate.of(2025, 6, 16);
    private static final LocalDate JULY_EXPIRY = LocalDate.of(2025, 7, 18);

    @Mock
    private TradeDateResolver tradeDateResolver;

    @Mock
    private MarketDataClient marketDataClient;

    @Mock
    private SnapshotStore snapshotStore;

    @Mock
    private AggregateViewRefresher aggregateViewRefresher;

    private MeterRegistry meterRegistry;
    private EodSnapshotJob eodSnapshotJob;

    @BeforeEach
    void setUp() {
        JobConfig jobConfig = new JobConfig();
        meterRegistry = new SimpleMeterRegistry();
        eodSnapshotJob = new EodSnapshotJob(
                tradeDateResolver,
                marketDataClient,
                new CarryRateReconciler(),
                new RowBuilder(jobConfig),
                snapshotStore,
                aggregateViewRefresher,
                jobConfig,
                new JobMetrics(meterRegistry));

        when(tradeDateResolver.resolve(null, null))
                .thenReturn(ResolvedDates.builder().sourceDate(FRIDAY).storedDate(MONDAY).build());
    }

    private static StrikeRecord record(String expiration, Double strike) {
        return StrikeRecord.builder()
                .ticker("SPX")
                .tradeDate("2025-06-13")
                .expirDate(expiration)
                .dte(35)
                .strike(strike)
                .stockPrice(4510.0)
                .callOpenInterest(1000)
                .putOpenInterest(2000)
                .gamma(0.002)
                .build();
    }

    @Nested
    @DisplayName("Empty Snapshot")
    class EmptySnapshot {

        @Test
        @DisplayName("No records: NO_DATA, carry not fetched, store untouched")
        void noRecords() {
            when(marketDataClient.fetchStrikes("SPX", FRIDAY)).thenReturn(List.of());

            RunResult result = eodSnapshotJob.run(null, null);

            assertThat(result.getOutcome()).isEqualTo(RunResult.Outcome.NO_DATA);
            assertThat(result.getWritten()).isZero();
            verify(marketDataClient, never()).fetchCarryQuotes(anyString(), any());
            verifyNoInteractions(snapshotStore, aggregateViewRefresher);
            assertThat(meterRegistry.get("gex.run.duration").tag("outcome", "NO_DATA").timer().count())
                    .isEqualTo(1);
        }

        @Test
        @DisplayName("Every record unkeyed: NO_DATA and the partition is left alone")
        void allRecordsDropped() {
            when(marketDataClient.fetchStrikes("SPX", FRIDAY))
                    .thenReturn(List.of(record("not-a-date", 4500.0), record("2025-07-18", null)));

            RunResult result = eodSnapshotJob.run(null, null);

            assertThat(result.getOutcome()).isEqualTo(RunResult.Outcome.NO_DATA);
            assertThat(result.getFetched()).isEqualTo(2);
            assertThat(result.getDropped()).isEqualTo(2);
            verifyNoInteractions(snapshotStore, aggregateViewRefresher);
        }
    }

    @Nested
    @DisplayName("Written Snapshot")
    class WrittenSnapshot {

        @Test
        @DisplayName("Rows are stamped with the stored date and carry the primary quote")
        void writesPartition() {
            when(marketDataClient.fetchStrikes("SPX", FRIDAY))
                    .thenReturn(List.of(record("2025-07-18", 4500.0), record("2025-07-18", null)));
            when(marketDataClient.fetchCarryQuotes("SPX", FRIDAY))
                    .thenReturn(new CarryQuote("SPX", FRIDAY, Map.of(JULY_EXPIRY, new CarryRate(0.043, 0.013))));
            when(marketDataClient.fetchCarryQuotes("SPY", FRIDAY)).thenReturn(CarryQuote.empty("SPY", FRIDAY));
            when(marketDataClient.fetchFallbackRate("SPX", FRIDAY)).thenReturn(Optional.of(0.04));
            when(snapshotStore.replacePartition(eq("SPX"), eq(MONDAY), anyList())).thenReturn(1);
            when(aggregateViewRefresher.refresh()).thenReturn(true);

            RunResult result = eodSnapshotJob.run(null, null);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<DerivedRow>> captor = ArgumentCaptor.forClass(List.class);
            verify(snapshotStore).replacePartition(eq("SPX"), eq(MONDAY), captor.capture());
            List<DerivedRow> rows = captor.getValue();
            assertThat(rows).hasSize(1);
            DerivedRow row = rows.get(0);
            assertThat(row.getTradeDate()).isEqualTo(MONDAY);
            assertThat(row.getDte()).isEqualTo(32);
            assertThat(row.getShortRate()).isEqualTo(0.043);
            assertThat(row.getDivYield()).isEqualTo(0.013);
            assertThat(row.getDiscountedStrike()).isNotNull();

            verify(aggregateViewRefresher).refresh();
            assertThat(result.getOutcome()).isEqualTo(RunResult.Outcome.WRITTEN);
            assertThat(result.getSourceDate()).isEqualTo(FRIDAY);
            assertThat(result.getStoredDate()).isEqualTo(MONDAY);
            assertThat(result.getDropped()).isEqualTo(1);
            assertThat(result.getWritten()).isEqualTo(1);

            assertThat(meterRegistry.get("gex.rows.written").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("gex.records.dropped").counter().count()).isEqualTo(1.0);
            assertThat(meterRegistry.get("gex.carry.resolved").tag("tier", "PRIMARY").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("No carry anywhere: rows are written with null carry and no discounted strike")
        void noCarry() {
            when(marketDataClient.fetchStrikes("SPX", FRIDAY)).thenReturn(List.of(record("2025-07-18", 4500.0)));
            when(marketDataClient.fetchCarryQuotes(anyString(), eq(FRIDAY))).thenReturn(CarryQuote.empty("SPX", FRIDAY));
            when(marketDataClient.fetchFallbackRate("SPX", FRIDAY)).thenReturn(Optional.empty());
            when(snapshotStore.replacePartition(eq("SPX"), eq(MONDAY), anyList())).thenReturn(1);

            eodSnapshotJob.run(null, null);

            @SuppressWarnings("unchecked")
            ArgumentCaptor<List<DerivedRow>> captor = ArgumentCaptor.forClass(List.class);
            verify(snapshotStore).replacePartition(eq("SPX"), eq(MONDAY), captor.capture());
            DerivedRow row = captor.getValue().get(0);
            assertThat(row.getShortRate()).isNull();
            assertThat(row.getDivYield()).isEqualTo(0.0);
            assertThat(row.getDiscountedStrike()).isNull();
        }

        @Test
        @DisplayName("A failed view refresh does not fail the run")
        void refreshFailureIsNotFatal() {
            when(marketDataClient.fetchStrikes("SPX", FRIDAY)).thenReturn(List.of(record("2025-07-18", 4500.0)));
            when(snapshotStore.replacePartition(eq("SPX"), eq(MONDAY), anyList())).thenReturn(1);
            when(aggregateViewRefresher.refresh()).thenReturn(false);

            RunResult result = eodSnapshotJob.run(null, null);

            assertThat(result.getOutcome()).isEqualTo(RunResult.Outcome.WRITTEN);
        }
    }

    @Test
    @DisplayName("Strike fetch failure propagates before anything is written")
    void fetchFailurePropagates() {
        when(marketDataClient.fetchStrikes("SPX", FRIDAY))
                .thenThrow(new FetchException("/hist/strikes", 500, "upstream down"));

        assertThatThrownBy(() -> eodSnapshotJob.run(null, null)).isInstanceOf(FetchException.class);
        verifyNoInteractions(snapshotStore, aggregateViewRefresher);
    }
}
