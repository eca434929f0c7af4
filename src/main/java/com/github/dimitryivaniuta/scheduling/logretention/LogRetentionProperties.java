package com.github.dimitryivaniuta.scheduling.logretention;

import com.github.dimitryivaniuta.scheduling.frequency.Frequency;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "log-retention")
public class LogRetentionProperties {

    static final Frequency DEFAULT_EXPIRATION = Frequency.ofWeeks(1);
    static final Frequency DEFAULT_CHECK_EVERY = Frequency.ofHours(1);

    private boolean enabled = true;

    // directory holding the log files written by logback-spring.xml
    @NotBlank
    private String path = "log";

    // how long a log file is kept; blank means the default (1w)
    private Frequency expiration = DEFAULT_EXPIRATION;

    private Frequency checkEvery = DEFAULT_CHECK_EVERY;

    // file names (without extension) are timestamps in this pattern
    @NotBlank
    private String filePattern = "yyyy-MM-dd HH-mm-ss";

    public Frequency effectiveExpiration() {
        return (expiration == null || expiration.isZero()) ? DEFAULT_EXPIRATION : expiration;
    }

    public Frequency effectiveCheckEvery() {
        return (checkEvery == null || checkEvery.isZero()) ? DEFAULT_CHECK_EVERY : checkEvery;
    }
}
