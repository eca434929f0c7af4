package com.github.dimitryivaniuta.scheduling.web;

import com.github.dimitryivaniuta.scheduling.frequency.Frequency;
import com.github.dimitryivaniuta.scheduling.scheduler.FrequencyScheduler;
import com.github.dimitryivaniuta.scheduling.scheduler.Resolution;
import com.github.dimitryivaniuta.scheduling.scheduler.ScheduleEntry;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/admin/scheduler")
public class SchedulerAdminController {

    private final FrequencyScheduler scheduler;
    private final Clock clock;

    // ---------- DTOs ----------
    public record SchedulerStatusResponse(
            boolean running,
            Instant now,
            List<EntryResponse> entries
    ) {}

    public record EntryResponse(
            String name,
            Frequency frequency,
            Resolution resolution,
            Instant lastRun,
            Instant nextRun,
            boolean externalLastRun,
            int runningInvocations
    ) {}

    public record FrequencyResponse(
            Frequency frequency,
            long value,
            String unit,
            Instant from,
            Instant nextRun
    ) {}

    // ---------- endpoints ----------

    @GetMapping
    public SchedulerStatusResponse status() {
        return new SchedulerStatusResponse(
                scheduler.isRunning(),
                clock.instant(),
                scheduler.entries().stream().map(this::toEntryResponse).toList()
        );
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        scheduler.start();
        return status();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        scheduler.stop();
        return status();
    }

    /**
     * Parses a frequency and shows when it would next fire, e.g.
     * {@code GET /api/admin/scheduler/frequency?value=1mo&from=2021-01-31T15:00:05Z}.
     */
    @GetMapping("/frequency")
    public FrequencyResponse frequency(@RequestParam @NotBlank String value,
                                       @RequestParam(required = false) Instant from) {
        Frequency f = Frequency.parse(value);
        Instant base = (from != null) ? from : clock.instant();
        return new FrequencyResponse(
                f,
                f.getValue(),
                f.getUnit().token(),
                base,
                f.nextRun(base, clock.getZone())
        );
    }

    // ---------- mapping ----------
    private EntryResponse toEntryResponse(ScheduleEntry e) {
        return new EntryResponse(
                e.getName(),
                e.getFrequency(),
                e.getResolution(),
                e.getLastRun(),
                e.getNextRun(),
                e.hasLastRunProvider(),
                e.getRunningInvocations()
        );
    }
}
