package com.enterprise.calendar.holiday.domain;

/**
 * The rule that decided a date's classification.
 */
public enum DayType {

    MOVED_WORKDAY(false),
    MOVED_HOLIDAY(true),
    ADDITIONAL_WORKDAY(false),
    WEEKEND(true),
    FIXED_HOLIDAY(true),
    GOOD_FRIDAY(true),
    EASTER_MONDAY(true),
    PENTECOST(true),
    WORKDAY(false);

    private final boolean holiday;

    DayType(boolean holiday) {
        this.holiday = holiday;
    }

    public boolean isHoliday() {
        return holiday;
    }
}
