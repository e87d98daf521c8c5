package com.enterprise.calendar.shared.tasklets.port;

import java.time.LocalDate;

/**
 * Determines whether a given date is a day off.
 */
@FunctionalInterface
public interface HolidayCalendar {

    boolean isHoliday(LocalDate date);

    default boolean isWorkday(LocalDate date) {
        return !isHoliday(date);
    }
}
