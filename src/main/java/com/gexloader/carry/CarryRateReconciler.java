package com.gexloader.carry;

import com.gexloader.domain.model.CarryRate;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Merges carry observations from the primary ticker, the proxy ticker and the scalar
 * fallback rate into one (shortRate, divYield) per expiration.
 *
 * <p>Tiers are tried in {@link CarryTier} declaration order and the first one that
 * produces a value wins. The last tier always answers, so the yield is never null:
 * a missing yield is treated as zero.
 */
@Component
public class CarryRateReconciler {

    private static final Logger log = LoggerFactory.getLogger(CarryRateReconciler.class);

    private final List<CarryTier> tiers;

    public CarryRateReconciler() {
        this(List.of(CarryTier.values()));
    }

    public CarryRateReconciler(List<CarryTier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    /** Resolves the carry for a single expiration. */
    public ResolvedCarry resolve(LocalDate expiration, CarryInputs inputs) {
        List<Supplier<Optional<ResolvedCarry>>> chain = new ArrayList<>();
        for (CarryTier tier : tiers) {
            chain.add(() -> tier.resolve(expiration, inputs).map(rate -> new ResolvedCarry(rate, tier)));
        }
        return FirstMatch.of(chain)
                .resolve()
                .orElseGet(() -> new ResolvedCarry(new CarryRate(inputs.getFallbackRate(), 0.0), CarryTier.FALLBACK));
    }

    /**
     * Resolves every distinct, non-null expiration.
     *
     * @return carry per expiration, in first-seen order
     */
    public Map<LocalDate, ResolvedCarry> reconcile(Collection<LocalDate> expirations, CarryInputs inputs) {
        Map<LocalDate, ResolvedCarry> resolved = new LinkedHashMap<>();
        Map<CarryTier, Integer> tierCounts = new EnumMap<>(CarryTier.class);
        expirations.stream().filter(Objects::nonNull).distinct().forEach(expiration -> {
            ResolvedCarry carry = resolve(expiration, inputs);
            resolved.put(expiration, carry);
            tierCounts.merge(carry.getTier(), 1, Integer::sum);
        });
        log.info("Carry reconciled for {} expirations: {}", resolved.size(), tierCounts);
        return resolved;
    }
}
