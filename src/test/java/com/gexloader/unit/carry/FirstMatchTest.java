package com.gexloader.unit.carry;

import static org.assertj.core.api.Assertions.assertThat;

import com.gexloader.carry.FirstMatch;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class FirstMatchTest {

    @Test
    void returnsFirstNonEmptyAndStopsEvaluating() {
        AtomicInteger laterCalls = new AtomicInteger();

        Optional<String> result = FirstMatch.<String>of(
                        Optional::empty,
                        () -> Optional.of("second"),
                        () -> {
                            laterCalls.incrementAndGet();
                            return Optional.of("third");
                        })
                .resolve();

        assertThat(result).contains("second");
        assertThat(laterCalls.get()).isZero();
    }

    @Test
    void allEmptyYieldsEmpty() {
        Optional<Double> result = FirstMatch.<Double>of(Optional::empty, Optional::empty).resolve();

        assertThat(result).isEmpty();
    }

    @Test
    void nullOptionalIsTreatedAsEmpty() {
        Optional<Integer> result = FirstMatch.<Integer>of(() -> null, () -> Optional.of(7)).resolve();

        assertThat(result).contains(7);
    }
}
