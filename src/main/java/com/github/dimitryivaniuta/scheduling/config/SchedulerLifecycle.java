package com.github.dimitryivaniuta.scheduling.config;

import com.github.dimitryivaniuta.scheduling.scheduler.FrequencyScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;

/**
 * Ties the scheduler's polling loops to the application context: started after all singletons are
 * ready (so tasks registered during startup are picked up), stopped before they are destroyed.
 */
@Slf4j
@RequiredArgsConstructor
public class SchedulerLifecycle implements SmartLifecycle {

    private final FrequencyScheduler scheduler;
    private final boolean autoStart;

    @Override
    public void start() {
        scheduler.start();
        log.info("Frequency scheduler started with {} entries", scheduler.entries().size());
    }

    @Override
    public void stop() {
        scheduler.stop();
        log.info("Frequency scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
