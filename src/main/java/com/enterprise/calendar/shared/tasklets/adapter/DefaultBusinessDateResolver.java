package com.enterprise.calendar.shared.tasklets.adapter;

import com.enterprise.calendar.shared.tasklets.port.BusinessDateResolver;
import com.enterprise.calendar.shared.tasklets.port.HolidayCalendar;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Walks away from today one day at a time. Weekends and holidays are left to
 * the {@link HolidayCalendar}, so moved workdays on a Saturday count as
 * business days.
 */
public class DefaultBusinessDateResolver implements BusinessDateResolver {

    private final HolidayCalendar calendar;
    private final Clock clock;

    public DefaultBusinessDateResolver(HolidayCalendar calendar, Clock clock) {
        this.calendar = Objects.requireNonNull(calendar, "calendar");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public LocalDate lastWeekday() {
        LocalDate date = today().minusDays(1);
        while (isWeekend(date)) {
            date = date.minusDays(1);
        }
        return date;
    }

    @Override
    public LocalDate lastBusinessDay() {
        LocalDate date = today().minusDays(1);
        while (calendar.isHoliday(date)) {
            date = date.minusDays(1);
        }
        return date;
    }

    @Override
    public LocalDate nextBusinessDay() {
        LocalDate date = today().plusDays(1);
        while (calendar.isHoliday(date)) {
            date = date.plusDays(1);
        }
        return date;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
