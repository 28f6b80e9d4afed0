package com.gexloader.calendar;

import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of date resolution: the session queried from the provider and the date the
 * snapshot is recorded under. The two differ under the default policy.
 */
@Data
@Builder
public class ResolvedDates {

    private final LocalDate sourceDate;
    private final LocalDate storedDate;
}
