package com.github.dimitryivaniuta.scheduling.scheduler;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingTaskErrorHandler implements TaskErrorHandler {

    @Override
    public void handleError(ScheduleEntry entry, Throwable error) {
        log.warn("Scheduled task failed entry={}, frequency={}, nextRun={}",
                entry.getName(), entry.getFrequency(), entry.getNextRun(), error);
    }
}
