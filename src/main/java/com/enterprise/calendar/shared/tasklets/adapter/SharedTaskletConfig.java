package com.enterprise.calendar.shared.tasklets.adapter;

import com.enterprise.calendar.shared.tasklets.port.BusinessDateResolver;
import com.enterprise.calendar.shared.tasklets.port.HolidayCalendar;

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;

/**
 * Business-date tasklet and the one-step job that runs it.
 *
 * <p>Needs a {@link HolidayCalendar} bean. Tests pin "today" with a
 * {@code @Primary} {@link Clock}.
 */
@Configuration
public class SharedTaskletConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public BusinessDateResolver businessDateResolver(HolidayCalendar calendar, Clock clock) {
        return new DefaultBusinessDateResolver(calendar, clock);
    }

    @Bean
    public BusinessDateTasklet businessDateTasklet(BusinessDateResolver resolver) {
        return new BusinessDateTasklet(resolver);
    }

    @Bean
    public Step businessDateStep(JobRepository jobRepository,
            PlatformTransactionManager transactionManager,
            BusinessDateTasklet businessDateTasklet) {
        return new StepBuilder("businessDateStep", jobRepository)
            .tasklet(businessDateTasklet, transactionManager)
            .build();
    }

    @Bean
    public Job businessDateJob(JobRepository jobRepository, Step businessDateStep) {
        return new JobBuilder("businessDateJob", jobRepository)
            .start(businessDateStep)
            .build();
    }
}
