package com.gexloader.calendar;

import java.time.LocalDate;

/**
 * Rule mapping "today" onto the (source date, stored date) pair, selected with the
 * {@code gex.job.date-policy} property.
 *
 * <pre>
 * NEXT_BUSINESS_DAY  stored = today (weekend rolls to Monday), source = last day with data before stored
 * SAME_AS_SOURCE     source = last day with data before today, stored = source
 * </pre>
 *
 * <p>Explicit overrides always win over the computed value.
 */
public enum StoredDatePolicy {
    NEXT_BUSINESS_DAY {
        @Override
        public ResolvedDates resolve(
                LocalDate today,
                LocalDate storedOverride,
                LocalDate sourceOverride,
                BusinessDayCalendar calendar,
                SourceDateFinder finder) {
            LocalDate stored = storedOverride != null ? storedOverride : calendar.onOrAfter(today);
            LocalDate source = sourceOverride != null ? sourceOverride : finder.findBefore(stored);
            return ResolvedDates.builder().storedDate(stored).sourceDate(source).build();
        }
    },

    SAME_AS_SOURCE {
        @Override
        public ResolvedDates resolve(
                LocalDate today,
                LocalDate storedOverride,
                LocalDate sourceOverride,
                BusinessDayCalendar calendar,
                SourceDateFinder finder) {
            LocalDate source;
            if (sourceOverride != null) {
                source = sourceOverride;
            } else if (storedOverride != null) {
                source = storedOverride;
            } else {
                source = finder.findBefore(today);
            }
            LocalDate stored = storedOverride != null ? storedOverride : source;
            return ResolvedDates.builder().storedDate(stored).sourceDate(source).build();
        }
    };

    public abstract ResolvedDates resolve(
            LocalDate today,
            LocalDate storedOverride,
            LocalDate sourceOverride,
            BusinessDayCalendar calendar,
            SourceDateFinder finder);
}
