package com.gexloader.unit.carry;

import static org.assertj.core.api.Assertions.assertThat;

import com.gexloader.carry.CarryInputs;
import com.gexloader.carry.CarryRateReconciler;
import com.gexloader.carry.CarryTier;
import com.gexloader.carry.ResolvedCarry;
import com.gexloader.domain.model.CarryQuote;
import com.gexloader.domain.model.CarryRate;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CarryRateReconciler covering each precedence tier and the
 * never-null yield guarantee.
 */
class CarryRateReconcilerTest {

    private static final LocalDate SOURCE = LocalDate.of(2025, 6, 13);
    private static final LocalDate EXP_JUL = LocalDate.of(2025, 7, 18);
    private static final LocalDate EXP_SEP = LocalDate.of(2025, 9, 19);

    private final CarryRateReconciler reconciler = new CarryRateReconciler();

    private static CarryQuote quote(String ticker, Map<LocalDate, CarryRate> rates) {
        return new CarryQuote(ticker, SOURCE, rates);
    }

    @Nested
    @DisplayName("Tier precedence")
    class Precedence {

        @Test
        @DisplayName("Primary quote with a non-zero yield wins")
        void primaryWins() {
            CarryInputs inputs = new CarryInputs(
                    quote("SPX", Map.of(EXP_JUL, new CarryRate(0.043, 0.013))),
                    quote("SPY", Map.of(EXP_JUL, new CarryRate(0.044, 0.015))),
                    0.05);

            ResolvedCarry carry = reconciler.resolve(EXP_JUL, inputs);

            assertThat(carry.getTier()).isEqualTo(CarryTier.PRIMARY);
            assertThat(carry.getRate().getShortRate()).isEqualTo(0.043);
            assertThat(carry.getRate().getDivYield()).isEqualTo(0.013);
        }

        @Test
        @DisplayName("Primary yield missing, proxy yield 0.015, fallback 0.05 -> (0.05, 0.015)")
        void proxyYieldWithFallbackRate() {
            CarryInputs inputs = new CarryInputs(
                    quote("SPX", Map.of()),
                    quote("SPY", Map.of(EXP_JUL, new CarryRate(null, 0.015))),
                    0.05);

            ResolvedCarry carry = reconciler.resolve(EXP_JUL, inputs);

            assertThat(carry.getTier()).isEqualTo(CarryTier.PROXY);
            assertThat(carry.getRate().getShortRate()).isEqualTo(0.05);
            assertThat(carry.getRate().getDivYield()).isEqualTo(0.015);
        }

        @Test
        @DisplayName("Zero primary yield defers to proxy yield, keeping the primary rate")
        void zeroPrimaryYieldUsesProxy() {
            CarryInputs inputs = new CarryInputs(
                    quote("SPX", Map.of(EXP_JUL, new CarryRate(0.042, 0.0))),
                    quote("SPY", Map.of(EXP_JUL, new CarryRate(0.044, 0.015))),
                    0.05);

            ResolvedCarry carry = reconciler.resolve(EXP_JUL, inputs);

            assertThat(carry.getTier()).isEqualTo(CarryTier.PROXY);
            assertThat(carry.getRate().getShortRate()).isEqualTo(0.042);
            assertThat(carry.getRate().getDivYield()).isEqualTo(0.015);
        }

        @Test
        @DisplayName("Proxy rate used when the primary has no quote for the expiration")
        void proxyRateWhenPrimaryMissing() {
            CarryInputs inputs = new CarryInputs(
                    quote("SPX", Map.of()), quote("SPY", Map.of(EXP_JUL, new CarryRate(0.044, 0.015))), 0.05);

            assertThat(reconciler.resolve(EXP_JUL, inputs).getRate().getShortRate())
                    .isEqualTo(0.044);
        }

        @Test
        @DisplayName("No yield anywhere -> scalar fallback rate with zero yield")
        void fallbackTier() {
            CarryInputs inputs = new CarryInputs(quote("SPX", Map.of()), quote("SPY", Map.of()), 0.05);

            ResolvedCarry carry = reconciler.resolve(EXP_JUL, inputs);

            assertThat(carry.getTier()).isEqualTo(CarryTier.FALLBACK);
            assertThat(carry.getRate().getShortRate()).isEqualTo(0.05);
            assertThat(carry.getRate().getDivYield()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Missing fallback rate leaves the short rate null but the yield at zero")
        void fallbackWithoutRate() {
            CarryInputs inputs = new CarryInputs(null, null, null);

            ResolvedCarry carry = reconciler.resolve(EXP_JUL, inputs);

            assertThat(carry.getRate().getShortRate()).isNull();
            assertThat(carry.getRate().getDivYield()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("Primary quote with a yield but no rate borrows the next available rate")
        void primaryWithoutRate() {
            CarryInputs inputs = new CarryInputs(
                    quote("SPX", Map.of(EXP_JUL, new CarryRate(null, 0.013))), quote("SPY", Map.of()), 0.05);

            ResolvedCarry carry = reconciler.resolve(EXP_JUL, inputs);

            assertThat(carry.getTier()).isEqualTo(CarryTier.PRIMARY);
            assertThat(carry.getRate().getShortRate()).isEqualTo(0.05);
        }
    }

    @Test
    @DisplayName("reconcile resolves each distinct expiration once and ignores nulls")
    void reconcileDistinctExpirations() {
        CarryInputs inputs = new CarryInputs(
                quote("SPX", Map.of(EXP_JUL, new CarryRate(0.043, 0.013))), quote("SPY", Map.of()), 0.05);

        Map<LocalDate, ResolvedCarry> resolved =
                reconciler.reconcile(Arrays.asList(EXP_JUL, EXP_SEP, null, EXP_JUL), inputs);

        assertThat(resolved).containsOnlyKeys(EXP_JUL, EXP_SEP);
        assertThat(resolved.get(EXP_JUL).getTier()).isEqualTo(CarryTier.PRIMARY);
        assertThat(resolved.get(EXP_SEP).getTier()).isEqualTo(CarryTier.FALLBACK);
        assertThat(resolved.values()).allSatisfy(c -> assertThat(c.getRate().getDivYield()).isNotNull());
    }
}
