package com.gexloader.carry;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Ordered fallback chain: evaluates each source lazily and returns the first non-empty
 * result. Later sources are never called once one has produced a value.
 */
public final class FirstMatch<T> {

    private final List<Supplier<Optional<T>>> sources;

    private FirstMatch(List<Supplier<Optional<T>>> sources) {
        this.sources = List.copyOf(sources);
    }

    public static <T> FirstMatch<T> of(List<Supplier<Optional<T>>> sources) {
        return new FirstMatch<>(sources);
    }

    @SafeVarargs
    public static <T> FirstMatch<T> of(Supplier<Optional<T>>... sources) {
        return new FirstMatch<>(List.of(sources));
    }

    public Optional<T> resolve() {
        for (Supplier<Optional<T>> source : sources) {
            Optional<T> value = source.get();
            if (value != null && value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
