package com.github.dimitryivaniuta.scheduling.scheduler;

import java.time.Duration;

/**
 * Optional observer for task execution (metrics, health).
 * Called on the task thread, except {@link #onTaskSkipped} which runs on the polling thread.
 */
public interface SchedulerListener {

    SchedulerListener NOOP = new SchedulerListener() {};

    default void onTaskStarted(ScheduleEntry entry) {}

    default void onTaskSucceeded(ScheduleEntry entry, Duration elapsed) {}

    default void onTaskFailed(ScheduleEntry entry, Throwable error, Duration elapsed) {}

    default void onTaskSkipped(ScheduleEntry entry) {}
}
