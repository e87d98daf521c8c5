package com.enterprise.calendar.holiday.domain;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.MonthDay;
import java.util.List;

/**
 * A holiday that recurs every year on the same month and day.
 */
public record FixedHoliday(int month, int day) {

    /**
     * Hungarian national fixed holidays.
     */
    public static final List<FixedHoliday> HUNGARIAN = List.of(
        new FixedHoliday(1, 1),    // New Year
        new FixedHoliday(3, 15),   // 1848 Revolution
        new FixedHoliday(5, 1),    // Labour Day
        new FixedHoliday(8, 20),   // State Foundation
        new FixedHoliday(10, 23),  // 1956 Revolution
        new FixedHoliday(11, 1),   // All Saints
        new FixedHoliday(12, 25),
        new FixedHoliday(12, 26),
        new FixedHoliday(12, 31)
    );

    public FixedHoliday {
        try {
            MonthDay.of(month, day);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException(
                "Invalid fixed holiday month/day: " + month + "/" + day, e);
        }
    }

    public boolean matches(LocalDate date) {
        return date.getMonthValue() == month && date.getDayOfMonth() == day;
    }
}
