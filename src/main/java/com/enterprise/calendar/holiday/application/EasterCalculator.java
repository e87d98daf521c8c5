package com.enterprise.calendar.holiday.application;

import com.enterprise.calendar.holiday.domain.DayType;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Movable Christian holidays for the Gregorian calendar, derived from the
 * Gauss computus with the constants valid for 1901–2099.
 */
public final class EasterCalculator {

    public static final int MIN_YEAR = 1901;
    public static final int MAX_YEAR = 2099;

    private static final int PENTECOST_OFFSET = 49;
    private static final int GOOD_FRIDAY_OFFSET = -3;

    private EasterCalculator() {}

    /**
     * Easter Monday of the given year, as an offset from March 1.
     *
     * @throws IllegalArgumentException if year is outside 1901–2099
     */
    public static LocalDate easterMonday(int year) {
        checkYear(year);
        int a = year % 19;
        int b = year % 4;
        int c = year % 7;
        int d = (19 * a + 24) % 30;
        int e = (2 * b + 4 * c + 6 * d + 5) % 7;

        int offset;
        if (e == 6 && d == 29) {
            offset = 50;
        } else {
            offset = e + 22 + d;
        }
        return LocalDate.of(year, 3, 1).plusDays(offset);
    }

    /**
     * Pentecost, 49 days after Easter Monday.
     *
     * @throws IllegalArgumentException if year is outside 1901–2099
     */
    public static LocalDate pentecost(int year) {
        return pentecost(easterMonday(year));
    }

    /**
     * Pentecost for an already computed Easter Monday.
     *
     * @throws IllegalArgumentException if the date's year is outside 1901–2099
     */
    public static LocalDate pentecost(LocalDate easterMonday) {
        Objects.requireNonNull(easterMonday, "easterMonday");
        checkYear(easterMonday.getYear());
        return easterMonday.plusDays(PENTECOST_OFFSET);
    }

    /** Good Friday, Easter Monday and Pentecost of the year, in calendar order. */
    public static Map<DayType, LocalDate> movableHolidays(int year) {
        LocalDate monday = easterMonday(year);
        Map<DayType, LocalDate> holidays = new EnumMap<>(DayType.class);
        holidays.put(DayType.GOOD_FRIDAY, monday.plusDays(GOOD_FRIDAY_OFFSET));
        holidays.put(DayType.EASTER_MONDAY, monday);
        holidays.put(DayType.PENTECOST, pentecost(monday));
        return holidays;
    }

    public static boolean isSupported(int year) {
        return year >= MIN_YEAR && year <= MAX_YEAR;
    }

    private static void checkYear(int year) {
        if (!isSupported(year)) {
            throw new IllegalArgumentException(
                "year must be between " + MIN_YEAR + " and " + MAX_YEAR + ": " + year);
        }
    }
}
