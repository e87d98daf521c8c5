package com.enterprise.calendar.holiday.domain;

import java.time.LocalDate;

public record CalendarDay(LocalDate date, DayType type) {}
