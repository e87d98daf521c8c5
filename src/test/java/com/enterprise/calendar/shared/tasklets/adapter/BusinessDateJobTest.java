package com.enterprise.calendar.shared.tasklets.adapter;

import com.enterprise.calendar.CalendarApplication;

import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.TestPropertySource;

import java.time.Clock;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * Boots the application with "today" pinned to Monday 2025-05-19, two days
 * after the configured Saturday workday of 2025-05-17.
 */
@SpringBootTest(classes = CalendarApplication.class)
@TestPropertySource(properties = "spring.batch.job.enabled=false")
@Import(BusinessDateJobTest.FixedClockConfig.class)
class BusinessDateJobTest {

    @Autowired private JobLauncher jobLauncher;
    @Autowired @Qualifier("businessDateJob") private Job businessDateJob;

    @Test
    void publishesBusinessDatesToJobContext() throws Exception {
        JobExecution execution = jobLauncher.run(businessDateJob,
            new JobParametersBuilder()
                .addLong("run.id", System.nanoTime())
                .toJobParameters());

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        var ctx = execution.getExecutionContext();
        assertThat(ctx.get(BusinessDateTasklet.LAST_WEEKDAY)).isEqualTo(LocalDate.of(2025, 5, 16));
        assertThat(ctx.get(BusinessDateTasklet.LAST_BUSINESS_DAY)).isEqualTo(LocalDate.of(2025, 5, 17));
        assertThat(ctx.get(BusinessDateTasklet.NEXT_BUSINESS_DAY)).isEqualTo(LocalDate.of(2025, 5, 20));
    }

    @TestConfiguration
    static class FixedClockConfig {

        @Bean
        @Primary
        Clock fixedClock() {
            return DefaultBusinessDateResolverTest.clockAt(LocalDate.of(2025, 5, 19));
        }
    }
}
