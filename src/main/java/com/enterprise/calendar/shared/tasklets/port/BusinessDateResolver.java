package com.enterprise.calendar.shared.tasklets.port;

import java.time.LocalDate;

/**
 * Resolves business-relevant dates relative to the current day.
 */
public interface BusinessDateResolver {

    /**
     * Previous day that falls on Monday–Friday. Ignores holidays and overrides.
     */
    LocalDate lastWeekday();

    /**
     * Previous day the holiday calendar treats as a workday.
     */
    LocalDate lastBusinessDay();

    /**
     * Next day the holiday calendar treats as a workday.
     */
    LocalDate nextBusinessDay();
}
