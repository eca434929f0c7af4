package com.github.dimitryivaniuta.scheduling.logretention;

import com.github.dimitryivaniuta.scheduling.frequency.Frequency;
import com.github.dimitryivaniuta.scheduling.scheduler.FrequencyScheduler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Deletes log files older than {@code log-retention.expiration}.
 *
 * A file qualifies when its name (minus the .log / .json extension) parses with
 * {@code log-retention.file-pattern} and that timestamp plus the expiration has been reached.
 * Files with other names are never touched.
 *
 * Runs once on startup, then on the scheduler every {@code log-retention.check-every} (default hourly).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@EnableConfigurationProperties(LogRetentionProperties.class)
@ConditionalOnProperty(prefix = "log-retention", name = "enabled", havingValue = "true", matchIfMissing = true)
public class LogRetentionJob {

    static final String ENTRY_NAME = "log-retention";

    private final FrequencyScheduler scheduler;
    private final LogRetentionProperties props;
    private final Clock clock;

    @PostConstruct
    void register() {
        try {
            sweep();
        } catch (UncheckedIOException ex) {
            log.warn("Initial log retention sweep failed for path={}", props.getPath(), ex);
        }
        scheduler.every(props.effectiveCheckEvery())
                .named(ENTRY_NAME)
                .execute(this::sweep);
    }

    /**
     * @return number of deleted files
     * @throws UncheckedIOException if the log directory cannot be listed
     */
    public int sweep() {
        Path dir = Path.of(props.getPath());
        if (!Files.isDirectory(dir)) {
            return 0;
        }

        Frequency expiration = props.effectiveExpiration();
        DateTimeFormatter format = DateTimeFormatter.ofPattern(props.getFilePattern());
        ZonedDateTime now = ZonedDateTime.now(clock);

        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.{log,json}")) {
            for (Path file : files) {
                Optional<ZonedDateTime> writtenAt = timestampOf(file, format);
                if (writtenAt.isEmpty() || !expiration.hasElapsed(writtenAt.get(), now)) {
                    continue;
                }
                try {
                    if (Files.deleteIfExists(file)) {
                        deleted++;
                        log.debug("Deleted old log file {} written at {}", file, writtenAt.get());
                    }
                } catch (IOException ex) {
                    log.warn("Could not delete old log file {}, reason={}", file, ex.toString());
                }
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot list log directory " + dir, ex);
        }

        if (deleted > 0) {
            log.info("Log retention deleted {} files older than {} from {}", deleted, expiration, dir);
        }
        return deleted;
    }

    private Optional<ZonedDateTime> timestampOf(Path file, DateTimeFormatter format) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = (dot > 0) ? name.substring(0, dot) : name;
        try {
            return Optional.of(LocalDateTime.parse(base, format).atZone(clock.getZone()));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
