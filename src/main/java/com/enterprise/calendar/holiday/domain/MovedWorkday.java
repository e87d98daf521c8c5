package com.enterprise.calendar.holiday.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A working day swapped with a rest day: {@code originalDay} becomes a
 * holiday and {@code movedToDay} is worked instead.
 */
public record MovedWorkday(LocalDate originalDay, LocalDate movedToDay) {

    public MovedWorkday {
        Objects.requireNonNull(originalDay, "originalDay");
        Objects.requireNonNull(movedToDay, "movedToDay");
    }
}
