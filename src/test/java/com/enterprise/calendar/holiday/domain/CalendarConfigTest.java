package com.enterprise.calendar.holiday.domain;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CalendarConfigTest {

    @Test
    void hungarianPresetHasNineFixedHolidays() {
        CalendarConfig config = CalendarConfig.hungarian();

        assertThat(config.fixedHolidays()).containsExactlyInAnyOrderElementsOf(FixedHoliday.HUNGARIAN);
        assertThat(config.fixedHolidays()).hasSize(9);
        assertThat(config.observeMovableHolidays()).isTrue();
        assertThat(config.movedWorkdays()).isEmpty();
        assertThat(config.additionalWorkdays()).isEmpty();
    }

    @Test
    void duplicateFixedHolidaysCollapse() {
        CalendarConfig config = CalendarConfig.builder()
            .fixedHoliday(12, 25)
            .fixedHoliday(12, 25)
            .build();

        assertThat(config.fixedHolidays()).containsExactly(new FixedHoliday(12, 25));
    }

    @Test
    void movedWorkdaysKeepInsertionOrder() {
        MovedWorkday first = new MovedWorkday(LocalDate.of(2025, 5, 2), LocalDate.of(2025, 5, 17));
        MovedWorkday second = new MovedWorkday(LocalDate.of(2025, 10, 24), LocalDate.of(2025, 10, 18));

        CalendarConfig config = CalendarConfig.builder().movedWorkdays(List.of(first, second)).build();

        assertThat(config.movedWorkdays()).containsExactly(first, second);
    }

    @Test
    void builtConfigIsDetachedFromCallerCollections() {
        List<LocalDate> extra = new ArrayList<>(List.of(LocalDate.of(2025, 12, 13)));
        CalendarConfig config = CalendarConfig.builder().additionalWorkdays(extra).build();

        extra.add(LocalDate.of(2025, 12, 20));

        assertThat(config.additionalWorkdays()).containsExactly(LocalDate.of(2025, 12, 13));
        assertThatThrownBy(() -> config.additionalWorkdays().add(LocalDate.of(2026, 1, 3)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void fixedHolidayValidatesMonthAndDay() {
        assertThatThrownBy(() -> new FixedHoliday(13, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FixedHoliday(4, 31)).isInstanceOf(IllegalArgumentException.class);
        assertThatNoException().isThrownBy(() -> new FixedHoliday(2, 29));
    }

    @Test
    void fixedHolidayMatchesEveryYear() {
        FixedHoliday stateFoundation = new FixedHoliday(8, 20);

        assertThat(stateFoundation.matches(LocalDate.of(1999, 8, 20))).isTrue();
        assertThat(stateFoundation.matches(LocalDate.of(2031, 8, 20))).isTrue();
        assertThat(stateFoundation.matches(LocalDate.of(2031, 8, 21))).isFalse();
    }

    @Test
    void movedWorkdayRequiresBothDates() {
        assertThatThrownBy(() -> new MovedWorkday(null, LocalDate.of(2025, 5, 17)))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> CalendarConfig.builder().additionalWorkday(null))
                .isInstanceOf(NullPointerException.class);
    }
}
