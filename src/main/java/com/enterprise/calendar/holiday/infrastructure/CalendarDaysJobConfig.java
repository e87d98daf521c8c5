package com.enterprise.calendar.holiday.infrastructure;

import com.enterprise.calendar.holiday.application.HolidayEngine;
import com.enterprise.calendar.holiday.domain.CalendarDay;
import com.enterprise.calendar.holiday.domain.DateRange;
import com.enterprise.calendar.shared.chunkutils.adapter.DateRangeItemReader;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;

/**
 * {@code calendarDaysJob}: classifies every day between the
 * {@code startDate} and {@code endDate} job parameters (inclusive) and
 * leaves the workday/holiday counts in the job execution context.
 */
@Configuration
public class CalendarDaysJobConfig {

    private static final int CHUNK_SIZE = 31;

    @Bean
    @StepScope
    public DateRangeItemReader calendarDayReader(
            @Value("#{jobParameters['startDate']}") LocalDate startDate,
            @Value("#{jobParameters['endDate']}") LocalDate endDate) {
        return new DateRangeItemReader("calendarDayReader", DateRange.of(startDate, endDate));
    }

    @Bean
    public ItemProcessor<LocalDate, CalendarDay> calendarDayProcessor(HolidayEngine engine) {
        return date -> new CalendarDay(date, engine.classify(date));
    }

    @Bean
    @StepScope
    public CalendarDayTallyWriter calendarDayTallyWriter() {
        return new CalendarDayTallyWriter();
    }

    @Bean
    public Step calendarDaysStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            DateRangeItemReader calendarDayReader,
            ItemProcessor<LocalDate, CalendarDay> calendarDayProcessor,
            CalendarDayTallyWriter calendarDayTallyWriter) {
        return new StepBuilder("calendarDaysStep", jobRepository)
            .<LocalDate, CalendarDay>chunk(CHUNK_SIZE, transactionManager)
            .reader(calendarDayReader)
            .processor(calendarDayProcessor)
            .writer(calendarDayTallyWriter)
            .listener((StepExecutionListener) calendarDayTallyWriter)
            .build();
    }

    @Bean
    public Job calendarDaysJob(JobRepository jobRepository, Step calendarDaysStep) {
        return new JobBuilder("calendarDaysJob", jobRepository)
            .start(calendarDaysStep)
            .build();
    }
}
