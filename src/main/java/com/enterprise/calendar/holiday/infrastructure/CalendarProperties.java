package com.enterprise.calendar.holiday.infrastructure;

import com.enterprise.calendar.holiday.domain.CalendarConfig;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar rules bound from {@code calendar.*}. Dates are ISO-8601 strings.
 *
 * <pre>
 * calendar:
 *   observe-movable-holidays: true
 *   fixed-holidays:            # empty: Hungarian preset
 *     - month: 1
 *       day: 1
 *   moved-workdays:
 *     - original: 2025-05-02
 *       moved-to: 2025-05-17
 *   additional-workdays:
 *     - 2025-12-13
 * </pre>
 */
@ConfigurationProperties(prefix = "calendar")
public class CalendarProperties {

    private boolean observeMovableHolidays = true;
    private List<FixedHolidayEntry> fixedHolidays = new ArrayList<>();
    private List<MovedWorkdayEntry> movedWorkdays = new ArrayList<>();
    private List<String> additionalWorkdays = new ArrayList<>();

    public boolean isObserveMovableHolidays() {
        return observeMovableHolidays;
    }

    public void setObserveMovableHolidays(boolean observeMovableHolidays) {
        this.observeMovableHolidays = observeMovableHolidays;
    }

    public List<FixedHolidayEntry> getFixedHolidays() {
        return fixedHolidays;
    }

    public void setFixedHolidays(List<FixedHolidayEntry> fixedHolidays) {
        this.fixedHolidays = fixedHolidays;
    }

    public List<MovedWorkdayEntry> getMovedWorkdays() {
        return movedWorkdays;
    }

    public void setMovedWorkdays(List<MovedWorkdayEntry> movedWorkdays) {
        this.movedWorkdays = movedWorkdays;
    }

    public List<String> getAdditionalWorkdays() {
        return additionalWorkdays;
    }

    public void setAdditionalWorkdays(List<String> additionalWorkdays) {
        this.additionalWorkdays = additionalWorkdays;
    }

    /**
     * @throws IllegalStateException if a date or month/day entry is invalid
     */
    public CalendarConfig toCalendarConfig() {
        CalendarConfig.Builder builder = CalendarConfig.builder()
                .observeMovableHolidays(observeMovableHolidays);
        for (int i = 0; i < fixedHolidays.size(); i++) {
            FixedHolidayEntry entry = fixedHolidays.get(i);
            try {
                builder.fixedHoliday(entry.getMonth(), entry.getDay());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException(
                    "Invalid calendar.fixed-holidays[" + i + "]: " + e.getMessage(), e);
            }
        }
        for (int i = 0; i < movedWorkdays.size(); i++) {
            MovedWorkdayEntry entry = movedWorkdays.get(i);
            String prefix = "calendar.moved-workdays[" + i + "]";
            builder.movedWorkday(
                parseDate(prefix + ".original", entry.getOriginal()),
                parseDate(prefix + ".moved-to", entry.getMovedTo()));
        }
        for (int i = 0; i < additionalWorkdays.size(); i++) {
            builder.additionalWorkday(
                parseDate("calendar.additional-workdays[" + i + "]", additionalWorkdays.get(i)));
        }
        return builder.build();
    }

    private static LocalDate parseDate(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException("Missing date for " + property);
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException(
                "Invalid date for " + property + ": '" + value + "'", e);
        }
    }

    public static class FixedHolidayEntry {

        private int month;
        private int day;

        public FixedHolidayEntry() {}

        public FixedHolidayEntry(int month, int day) {
            this.month = month;
            this.day = day;
        }

        public int getMonth() {
            return month;
        }

        public void setMonth(int month) {
            this.month = month;
        }

        public int getDay() {
            return day;
        }

        public void setDay(int day) {
            this.day = day;
        }
    }

    public static class MovedWorkdayEntry {

        private String original;
        private String movedTo;

        public MovedWorkdayEntry() {}

        public MovedWorkdayEntry(String original, String movedTo) {
            this.original = original;
            this.movedTo = movedTo;
        }

        public String getOriginal() {
            return original;
        }

        public void setOriginal(String original) {
            this.original = original;
        }

        public String getMovedTo() {
            return movedTo;
        }

        public void setMovedTo(String movedTo) {
            this.movedTo = movedTo;
        }
    }
}
