package com.gexloader.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import org.springframework.stereotype.Component;

/**
 * Monday-to-Friday business-day arithmetic.
 *
 * <p>There is no holiday table: an exchange holiday is treated as a business day and
 * simply yields no provider data, which the source-date search already tolerates.
 */
@Component
public class BusinessDayCalendar {

    /** Returns true for Monday through Friday. */
    public boolean isBusinessDay(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        return dow != DayOfWeek.SATURDAY && dow != DayOfWeek.SUNDAY;
    }

    /** Returns the first business day strictly after the given date. */
    public LocalDate nextBusinessDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isBusinessDay(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Returns the last business day strictly before the given date. */
    public LocalDate previousBusinessDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isBusinessDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    /** Returns the date itself when it is a business day, otherwise the next one. */
    public LocalDate onOrAfter(LocalDate date) {
        return isBusinessDay(date) ? date : nextBusinessDay(date);
    }
}
