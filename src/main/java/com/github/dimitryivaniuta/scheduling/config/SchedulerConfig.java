package com.github.dimitryivaniuta.scheduling.config;

import com.github.dimitryivaniuta.scheduling.scheduler.FrequencyScheduler;
import com.github.dimitryivaniuta.scheduling.scheduler.LoggingTaskErrorHandler;
import com.github.dimitryivaniuta.scheduling.scheduler.SchedulerProperties;
import com.github.dimitryivaniuta.scheduling.scheduler.TaskErrorHandler;
import com.github.dimitryivaniuta.scheduling.scheduler.metrics.SchedulerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Scheduler wiring:
 * - one FrequencyScheduler per application context (inject it, do not create ad-hoc instances)
 * - failures logged by LoggingTaskErrorHandler, runs counted by SchedulerMetrics
 * - loops started/stopped with the context by SchedulerLifecycle (frequency-scheduler.auto-start)
 */
@Configuration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SchedulerConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskErrorHandler taskErrorHandler() {
        return new LoggingTaskErrorHandler();
    }

    @Bean
    public SchedulerMetrics schedulerMetrics(MeterRegistry registry) {
        return new SchedulerMetrics(registry);
    }

    @Bean(destroyMethod = "close")
    public FrequencyScheduler frequencyScheduler(Clock clock,
                                                 SchedulerProperties props,
                                                 TaskErrorHandler taskErrorHandler,
                                                 SchedulerMetrics schedulerMetrics) {
        return new FrequencyScheduler(clock, props, taskErrorHandler, schedulerMetrics);
    }

    @Bean
    public SchedulerLifecycle schedulerLifecycle(FrequencyScheduler scheduler, SchedulerProperties props) {
        return new SchedulerLifecycle(scheduler, props.isAutoStart());
    }
}
