package com.enterprise.calendar.holiday.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable rule set a {@code HolidayEngine} classifies dates against.
 *
 * <p>Built once through {@link #builder()}; collections are copied on
 * {@link Builder#build()}. When no fixed holidays are given the
 * {@link FixedHoliday#HUNGARIAN} set is used.
 *
 * <pre>{@code
 * CalendarConfig config = CalendarConfig.builder()
 *     .movedWorkday(LocalDate.of(2025, 5, 2), LocalDate.of(2025, 5, 17))
 *     .additionalWorkday(LocalDate.of(2025, 12, 13))
 *     .build();
 * }</pre>
 */
public final class CalendarConfig {

    private final Set<FixedHoliday> fixedHolidays;
    private final List<MovedWorkday> movedWorkdays;
    private final Set<LocalDate> additionalWorkdays;
    private final boolean observeMovableHolidays;

    private CalendarConfig(Builder b) {
        this.fixedHolidays = b.fixedHolidays.isEmpty()
                ? Set.copyOf(FixedHoliday.HUNGARIAN)
                : Set.copyOf(b.fixedHolidays);
        this.movedWorkdays = List.copyOf(b.movedWorkdays);
        this.additionalWorkdays = Set.copyOf(b.additionalWorkdays);
        this.observeMovableHolidays = b.observeMovableHolidays;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Hungarian fixed holidays, movable holidays observed, no overrides. */
    public static CalendarConfig hungarian() {
        return builder().build();
    }

    public Set<FixedHoliday> fixedHolidays() {
        return fixedHolidays;
    }

    public List<MovedWorkday> movedWorkdays() {
        return movedWorkdays;
    }

    public Set<LocalDate> additionalWorkdays() {
        return additionalWorkdays;
    }

    public boolean observeMovableHolidays() {
        return observeMovableHolidays;
    }

    @Override
    public String toString() {
        return "CalendarConfig[fixedHolidays=" + fixedHolidays.size()
                + ", movedWorkdays=" + movedWorkdays.size()
                + ", additionalWorkdays=" + additionalWorkdays.size()
                + ", observeMovableHolidays=" + observeMovableHolidays + "]";
    }

    public static final class Builder {

        private final Set<FixedHoliday> fixedHolidays = new LinkedHashSet<>();
        private final List<MovedWorkday> movedWorkdays = new ArrayList<>();
        private final Set<LocalDate> additionalWorkdays = new LinkedHashSet<>();
        private boolean observeMovableHolidays = true;

        private Builder() {}

        public Builder fixedHoliday(int month, int day) {
            fixedHolidays.add(new FixedHoliday(month, day));
            return this;
        }

        public Builder fixedHolidays(Collection<FixedHoliday> holidays) {
            Objects.requireNonNull(holidays, "holidays");
            holidays.forEach(h -> fixedHolidays.add(Objects.requireNonNull(h, "fixed holiday")));
            return this;
        }

        public Builder movedWorkday(LocalDate originalDay, LocalDate movedToDay) {
            movedWorkdays.add(new MovedWorkday(originalDay, movedToDay));
            return this;
        }

        public Builder movedWorkdays(Collection<MovedWorkday> moved) {
            Objects.requireNonNull(moved, "moved");
            moved.forEach(m -> movedWorkdays.add(Objects.requireNonNull(m, "moved workday")));
            return this;
        }

        public Builder additionalWorkday(LocalDate date) {
            additionalWorkdays.add(Objects.requireNonNull(date, "additional workday"));
            return this;
        }

        public Builder additionalWorkdays(Collection<LocalDate> dates) {
            Objects.requireNonNull(dates, "dates");
            dates.forEach(this::additionalWorkday);
            return this;
        }

        public Builder observeMovableHolidays(boolean observe) {
            this.observeMovableHolidays = observe;
            return this;
        }

        public CalendarConfig build() {
            return new CalendarConfig(this);
        }
    }
}
