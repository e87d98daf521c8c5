package com.enterprise.calendar.holiday.infrastructure;

import com.enterprise.calendar.holiday.application.HolidayEngine;
import com.enterprise.calendar.holiday.domain.CalendarConfig;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the {@link HolidayEngine} from {@link CalendarProperties}. The engine
 * also serves as the application's
 * {@link com.enterprise.calendar.shared.tasklets.port.HolidayCalendar}.
 */
@Configuration
@EnableConfigurationProperties(CalendarProperties.class)
public class HolidayEngineConfig {

    @Bean
    public CalendarConfig calendarConfig(CalendarProperties properties) {
        return properties.toCalendarConfig();
    }

    @Bean
    public HolidayEngine holidayEngine(CalendarConfig calendarConfig) {
        return new HolidayEngine(calendarConfig);
    }
}
