package com.gexloader.calendar;

import java.time.LocalDate;

/**
 * Finds the latest business day strictly before {@code before} that has provider data.
 */
@FunctionalInterface
public interface SourceDateFinder {

    /**
     * @throws com.gexloader.exception.NoSourceDateFoundException if the lookback window is exhausted
     */
    LocalDate findBefore(LocalDate before);
}
