package com.github.dimitryivaniuta.scheduling.scheduler.metrics;

import com.github.dimitryivaniuta.scheduling.scheduler.ScheduleEntry;
import com.github.dimitryivaniuta.scheduling.scheduler.SchedulerListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer counters and timers per schedule entry.
 * Entry names end up as tag values; keep them low-cardinality (no ids or timestamps).
 */
public class SchedulerMetrics implements SchedulerListener {

    private final MeterRegistry registry;

    public SchedulerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onTaskSucceeded(ScheduleEntry entry, Duration elapsed) {
        run(entry, "success");
        recordDuration(entry, "success", elapsed);
    }

    @Override
    public void onTaskFailed(ScheduleEntry entry, Throwable error, Duration elapsed) {
        run(entry, "failure");
        Counter.builder("frequency_scheduler_task_failures_total")
                .tag("entry", entry.getName())
                .tag("exception", error.getClass().getSimpleName())
                .register(registry)
                .increment();
        recordDuration(entry, "failure", elapsed);
    }

    @Override
    public void onTaskSkipped(ScheduleEntry entry) {
        Counter.builder("frequency_scheduler_task_skipped_total")
                .tag("entry", entry.getName())
                .register(registry)
                .increment();
    }

    private void run(ScheduleEntry entry, String outcome) {
        Counter.builder("frequency_scheduler_task_runs_total")
                .tag("entry", entry.getName())
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    private void recordDuration(ScheduleEntry entry, String outcome, Duration elapsed) {
        Timer.builder("frequency_scheduler_task_duration_seconds")
                .tag("entry", entry.getName())
                .tag("outcome", outcome)
                .register(registry)
                .record(elapsed);
    }
}
