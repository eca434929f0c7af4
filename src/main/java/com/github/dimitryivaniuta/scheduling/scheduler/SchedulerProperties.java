package com.github.dimitryivaniuta.scheduling.scheduler;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "frequency-scheduler")
public class SchedulerProperties {
    // start the polling loops together with the application context
    private boolean autoStart = true;

    // polling period for entries with a sub-day frequency (s / m / h)
    @NotNull
    private Duration fineResolution = Duration.ofMillis(100);

    // polling period for entries with day-or-larger frequencies (d / w / mo / y)
    @NotNull
    private Duration coarseResolution = Duration.ofMinutes(5);

    @NotNull
    private OverlapPolicy overlapPolicy = OverlapPolicy.ALLOW;

    // 0 = unbounded (one thread per concurrent invocation)
    @PositiveOrZero
    private int maxConcurrentTasks = 0;

    @NotBlank
    private String threadNamePrefix = "freq-sched-";
}
