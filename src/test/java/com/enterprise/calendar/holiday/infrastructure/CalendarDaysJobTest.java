package com.enterprise.calendar.holiday.infrastructure;

import com.enterprise.calendar.CalendarApplication;
import com.enterprise.calendar.holiday.application.HolidayEngine;
import com.enterprise.calendar.holiday.domain.DayCount;

import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.TestPropertySource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.*;

/**
 * Runs {@code calendarDaysJob} against the rules in {@code application.yml}
 * (Hungarian preset plus the 2025 moved workdays).
 */
@SpringBootTest(classes = CalendarApplication.class)
@TestPropertySource(properties = "spring.batch.job.enabled=false")
class CalendarDaysJobTest {

    @Autowired private JobLauncher jobLauncher;
    @Autowired @Qualifier("calendarDaysJob") private Job calendarDaysJob;
    @Autowired private HolidayEngine engine;

    @Test
    void engineIsBuiltFromApplicationProperties() {
        assertThat(engine.config().movedWorkdays()).hasSize(3);
        assertThat(engine.isHoliday(LocalDate.of(2025, 5, 2))).isTrue();
        assertThat(engine.isHoliday(LocalDate.of(2025, 5, 17))).isFalse();
    }

    @Test
    void countsMarch2025() throws Exception {
        JobExecution execution = run(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 3, 31));

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExecutionContext().getInt(CalendarDayTallyWriter.WORKDAYS_KEY)).isEqualTo(21);
        assertThat(execution.getExecutionContext().getInt(CalendarDayTallyWriter.HOLIDAYS_KEY)).isEqualTo(10);
    }

    @Test
    void countsOctober2025WithMovedWorkday() throws Exception {
        JobExecution execution = run(LocalDate.of(2025, 10, 1), LocalDate.of(2025, 10, 31));

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(execution.getExecutionContext().getInt(CalendarDayTallyWriter.WORKDAYS_KEY)).isEqualTo(22);
        assertThat(execution.getExecutionContext().getInt(CalendarDayTallyWriter.HOLIDAYS_KEY)).isEqualTo(9);
    }

    @Test
    void agreesWithCountDaysOverAWholeYear() throws Exception {
        LocalDate start = LocalDate.of(2024, 1, 1);
        LocalDate end = LocalDate.of(2024, 12, 31);

        JobExecution execution = run(start, end);
        DayCount expected = engine.countDays(start, end);

        assertThat(execution.getStepExecutions().iterator().next().getReadCount()).isEqualTo(366L);
        assertThat(execution.getExecutionContext().getInt(CalendarDayTallyWriter.WORKDAYS_KEY))
                .isEqualTo(expected.workdays());
        assertThat(execution.getExecutionContext().getInt(CalendarDayTallyWriter.HOLIDAYS_KEY))
                .isEqualTo(expected.holidays());
    }

    @Test
    void reversedRangeFailsTheJob() throws Exception {
        JobExecution execution = run(LocalDate.of(2025, 2, 1), LocalDate.of(2025, 1, 1));

        assertThat(execution.getStatus()).isEqualTo(BatchStatus.FAILED);
    }

    private JobExecution run(LocalDate start, LocalDate end) throws Exception {
        return jobLauncher.run(calendarDaysJob,
            new JobParametersBuilder()
                .addLocalDate("startDate", start)
                .addLocalDate("endDate", end)
                .addLong("run.id", System.nanoTime())
                .toJobParameters());
    }
}
