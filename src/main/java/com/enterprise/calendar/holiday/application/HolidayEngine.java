package com.enterprise.calendar.holiday.application;

import com.enterprise.calendar.holiday.domain.CalendarConfig;
import com.enterprise.calendar.holiday.domain.DateRange;
import com.enterprise.calendar.holiday.domain.DayCount;
import com.enterprise.calendar.holiday.domain.DayType;
import com.enterprise.calendar.holiday.domain.FixedHoliday;
import com.enterprise.calendar.holiday.domain.MovedWorkday;
import com.enterprise.calendar.shared.tasklets.port.HolidayCalendar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Classifies dates as holidays or workdays against a {@link CalendarConfig}
 * and answers range queries on top of that single decision.
 *
 * <p>Rules are checked in a fixed order and the first match wins:
 * <ol>
 *   <li>moved-to day of a {@link MovedWorkday}: workday</li>
 *   <li>original day of a {@link MovedWorkday}: holiday</li>
 *   <li>additional workday: workday</li>
 *   <li>Saturday or Sunday: holiday</li>
 *   <li>fixed holiday: holiday</li>
 *   <li>Good Friday, Easter Monday, Pentecost (when observed): holiday</li>
 *   <li>anything else: workday</li>
 * </ol>
 *
 * <p>Instances are immutable and may be shared between threads.
 */
public class HolidayEngine implements HolidayCalendar {

    private static final Logger log = LoggerFactory.getLogger(HolidayEngine.class);

    private final CalendarConfig config;

    public HolidayEngine(CalendarConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        log.info("Holiday engine ready: {}", config);
    }

    /** Engine over the Hungarian preset. */
    public HolidayEngine() {
        this(CalendarConfig.hungarian());
    }

    public CalendarConfig config() {
        return config;
    }

    // ==================== Classification ====================

    public DayType classify(LocalDate date) {
        Objects.requireNonNull(date, "date");

        for (MovedWorkday moved : config.movedWorkdays()) {
            if (moved.movedToDay().equals(date)) {
                return DayType.MOVED_WORKDAY;
            }
        }
        for (MovedWorkday moved : config.movedWorkdays()) {
            if (moved.originalDay().equals(date)) {
                return DayType.MOVED_HOLIDAY;
            }
        }
        if (config.additionalWorkdays().contains(date)) {
            return DayType.ADDITIONAL_WORKDAY;
        }
        if (isWeekend(date)) {
            return DayType.WEEKEND;
        }
        for (FixedHoliday holiday : config.fixedHolidays()) {
            if (holiday.matches(date)) {
                return DayType.FIXED_HOLIDAY;
            }
        }
        if (config.observeMovableHolidays()) {
            for (Map.Entry<DayType, LocalDate> movable
                    : EasterCalculator.movableHolidays(date.getYear()).entrySet()) {
                if (movable.getValue().equals(date)) {
                    return movable.getKey();
                }
            }
        }
        return DayType.WORKDAY;
    }

    /**
     * @throws IllegalArgumentException if movable holidays are observed and
     *         the date's year is outside 1901–2099
     */
    @Override
    public boolean isHoliday(LocalDate date) {
        return classify(date).isHoliday();
    }

    // ==================== Range queries ====================

    /**
     * @throws IllegalArgumentException if start is after end
     */
    public List<LocalDate> workdays(LocalDate start, LocalDate end) {
        return workdays(DateRange.of(start, end));
    }

    public List<LocalDate> workdays(DateRange range) {
        List<LocalDate> result = range.days().filter(this::isWorkday).collect(Collectors.toList());
        log.debug("{} workdays in {}", result.size(), range);
        return result;
    }

    /**
     * @throws IllegalArgumentException if start is after end
     */
    public List<LocalDate> holidays(LocalDate start, LocalDate end) {
        return holidays(DateRange.of(start, end));
    }

    public List<LocalDate> holidays(DateRange range) {
        List<LocalDate> result = range.days().filter(this::isHoliday).collect(Collectors.toList());
        log.debug("{} holidays in {}", result.size(), range);
        return result;
    }

    /**
     * Workdays and holidays in the range, counted in one pass.
     *
     * @throws IllegalArgumentException if start is after end
     */
    public DayCount countDays(LocalDate start, LocalDate end) {
        return countDays(DateRange.of(start, end));
    }

    public DayCount countDays(DateRange range) {
        int workdays = 0;
        int holidays = 0;
        for (LocalDate d = range.start(); !d.isAfter(range.end()); d = d.plusDays(1)) {
            if (isHoliday(d)) {
                holidays++;
            } else {
                workdays++;
            }
        }
        return new DayCount(workdays, holidays);
    }

    // ==================== Navigation ====================

    /** Closest workday strictly after the date. */
    public LocalDate nextWorkday(LocalDate date) {
        Objects.requireNonNull(date, "date");
        LocalDate d = date.plusDays(1);
        while (isHoliday(d)) {
            d = d.plusDays(1);
        }
        return d;
    }

    /** Closest workday strictly before the date. */
    public LocalDate previousWorkday(LocalDate date) {
        Objects.requireNonNull(date, "date");
        LocalDate d = date.minusDays(1);
        while (isHoliday(d)) {
            d = d.minusDays(1);
        }
        return d;
    }

    /**
     * Moves {@code workdays} workdays away from the date; negative values move
     * backwards and zero returns the date itself.
     */
    public LocalDate addWorkdays(LocalDate date, int workdays) {
        Objects.requireNonNull(date, "date");
        LocalDate d = date;
        for (int i = 0; i < Math.abs(workdays); i++) {
            d = workdays > 0 ? nextWorkday(d) : previousWorkday(d);
        }
        return d;
    }

    private static boolean isWeekend(LocalDate date) {
        DayOfWeek day = date.getDayOfWeek();
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
