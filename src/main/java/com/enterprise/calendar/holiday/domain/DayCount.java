package com.enterprise.calendar.holiday.domain;

public record DayCount(int workdays, int holidays) {

    public static final DayCount ZERO = new DayCount(0, 0);

    public DayCount add(DayType type) {
        return type.isHoliday()
                ? new DayCount(workdays, holidays + 1)
                : new DayCount(workdays + 1, holidays);
    }

    public int total() {
        return workdays + holidays;
    }
}
