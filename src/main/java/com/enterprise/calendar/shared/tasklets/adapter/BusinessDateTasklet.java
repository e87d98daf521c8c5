package com.enterprise.calendar.shared.tasklets.adapter;

import com.enterprise.calendar.shared.tasklets.port.BusinessDateResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.time.LocalDate;

/**
 * Resolves business dates and writes them to the
 * {@link org.springframework.batch.core.JobExecution} execution context
 * so downstream steps can read them.
 *
 * <p>Writes {@value #LAST_WEEKDAY}, {@value #LAST_BUSINESS_DAY} and
 * {@value #NEXT_BUSINESS_DAY}.
 */
public class BusinessDateTasklet implements Tasklet {

    public static final String LAST_WEEKDAY = "lastWeekday";
    public static final String LAST_BUSINESS_DAY = "lastBusinessDay";
    public static final String NEXT_BUSINESS_DAY = "nextBusinessDay";

    private static final Logger log = LoggerFactory.getLogger(BusinessDateTasklet.class);

    private final BusinessDateResolver resolver;

    public BusinessDateTasklet(BusinessDateResolver resolver) {
        this.resolver = resolver;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        var ctx = chunkContext.getStepContext()
                .getStepExecution()
                .getJobExecution()
                .getExecutionContext();
        LocalDate lastBusinessDay = resolver.lastBusinessDay();
        ctx.put(LAST_WEEKDAY, resolver.lastWeekday());
        ctx.put(LAST_BUSINESS_DAY, lastBusinessDay);
        ctx.put(NEXT_BUSINESS_DAY, resolver.nextBusinessDay());
        log.info("Resolved business dates: lastBusinessDay={}", lastBusinessDay);
        return RepeatStatus.FINISHED;
    }
}
