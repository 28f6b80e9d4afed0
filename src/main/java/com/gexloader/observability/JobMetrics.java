package com.gexloader.observability;

import com.gexloader.carry.CarryTier;
import com.gexloader.carry.ResolvedCarry;
import com.gexloader.domain.model.RunResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for loader runs:
 * <ul>
 *   <li><b>gex.rows.written</b> (counter): rows inserted into the store</li>
 *   <li><b>gex.records.dropped</b> (counter): records skipped during row building</li>
 *   <li><b>gex.carry.resolved</b> (counter, tag tier): expirations resolved per carry tier</li>
 *   <li><b>gex.run.duration</b> (timer, tag outcome): wall time of a run</li>
 * </ul>
 */
@Service
public class JobMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter rowsWrittenCounter;
    private final Counter recordsDroppedCounter;
    private final Map<CarryTier, Counter> carryTierCounters = new EnumMap<>(CarryTier.class);

    public JobMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.rowsWrittenCounter = Counter.builder("gex.rows.written")
                .description("Strike rows inserted into orats_oi_gamma")
                .register(meterRegistry);
        this.recordsDroppedCounter = Counter.builder("gex.records.dropped")
                .description("Provider records skipped because they could not be built or keyed")
                .register(meterRegistry);
        for (CarryTier tier : CarryTier.values()) {
            carryTierCounters.put(
                    tier,
                    Counter.builder("gex.carry.resolved")
                            .description("Expirations whose carry was resolved by the tagged tier")
                            .tag("tier", tier.name())
                            .register(meterRegistry));
        }
    }

    public void recordCarry(Collection<ResolvedCarry> resolved) {
        resolved.forEach(carry -> carryTierCounters.get(carry.getTier()).increment());
    }

    public void recordRun(RunResult result) {
        rowsWrittenCounter.increment(result.getWritten());
        recordsDroppedCounter.increment(result.getDropped());
        Timer.builder("gex.run.duration")
                .description("Wall time of one loader run")
                .tag("outcome", result.getOutcome().name())
                .register(meterRegistry)
                .record(Duration.ofMillis(result.getDurationMs()));
    }
}
