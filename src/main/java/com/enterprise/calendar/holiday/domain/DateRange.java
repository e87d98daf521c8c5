package com.enterprise.calendar.holiday.domain;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Inclusive range of calendar days.
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("startDate must be <= endDate");
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        return new DateRange(start, end);
    }

    public long length() {
        return ChronoUnit.DAYS.between(start, end) + 1;
    }

    /** Every day of the range, ascending. */
    public Stream<LocalDate> days() {
        return Stream.iterate(start, d -> !d.isAfter(end), d -> d.plusDays(1));
    }
}
