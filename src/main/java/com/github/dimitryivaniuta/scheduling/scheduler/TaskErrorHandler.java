package com.github.dimitryivaniuta.scheduling.scheduler;

/**
 * Receives failures the scheduler intercepted: a task that threw, a last-run provider that threw,
 * or a dispatch the task executor rejected. The entry stays scheduled in every case.
 */
@FunctionalInterface
public interface TaskErrorHandler {
    void handleError(ScheduleEntry entry, Throwable error);
}
