package com.enterprise.calendar.holiday.infrastructure;

import com.enterprise.calendar.holiday.domain.CalendarDay;
import com.enterprise.calendar.holiday.domain.DayCount;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.ExitStatus;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemWriter;

/**
 * Counts classified days. The running tally lives in the step execution
 * context and is copied to the job execution context when the step ends,
 * under {@value #WORKDAYS_KEY} and {@value #HOLIDAYS_KEY}.
 */
public class CalendarDayTallyWriter implements ItemWriter<CalendarDay>, StepExecutionListener {

    public static final String WORKDAYS_KEY = "workdays";
    public static final String HOLIDAYS_KEY = "holidays";

    private static final Logger log = LoggerFactory.getLogger(CalendarDayTallyWriter.class);

    private StepExecution stepExecution;
    private DayCount tally = DayCount.ZERO;

    @Override
    public void beforeStep(StepExecution stepExecution) {
        this.stepExecution = stepExecution;
        ExecutionContext ctx = stepExecution.getExecutionContext();
        tally = new DayCount(ctx.getInt(WORKDAYS_KEY, 0), ctx.getInt(HOLIDAYS_KEY, 0));
    }

    @Override
    public void write(Chunk<? extends CalendarDay> chunk) {
        for (CalendarDay day : chunk) {
            log.debug("{} {}", day.date(), day.type());
            tally = tally.add(day.type());
        }
        if (stepExecution != null) {
            ExecutionContext ctx = stepExecution.getExecutionContext();
            ctx.putInt(WORKDAYS_KEY, tally.workdays());
            ctx.putInt(HOLIDAYS_KEY, tally.holidays());
        }
    }

    @Override
    public ExitStatus afterStep(StepExecution stepExecution) {
        ExecutionContext jobCtx = stepExecution.getJobExecution().getExecutionContext();
        jobCtx.putInt(WORKDAYS_KEY, tally.workdays());
        jobCtx.putInt(HOLIDAYS_KEY, tally.holidays());
        log.info("Calendar days: {} workdays, {} holidays", tally.workdays(), tally.holidays());
        return stepExecution.getExitStatus();
    }
}
