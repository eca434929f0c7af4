package com.github.dimitryivaniuta.scheduling.frequency;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * A human-readable recurring interval: one integer magnitude and one unit ("100s", "2w", "1mo", "-5s").
 *
 * Representation:
 * - s / m / h (and programmatic ms) are stored as a fixed {@link Duration}, always below 24h when parsed
 * - d / w / mo / y are stored as calendar fields and applied with calendar arithmetic
 *
 * Exactly one component is non-zero. {@link #NONE} (everything zero) means "not set" and is never
 * produced by {@link #parse(String)}. Instances are immutable and compared structurally.
 */
@Getter
@EqualsAndHashCode
public final class Frequency {

    /** Sentinel for "not set"; prints as an empty string. */
    public static final Frequency NONE = new Frequency(Duration.ZERO, 0, 0, 0, 0, null);

    private static final long SECONDS_PER_MINUTE = 60;
    private static final long SECONDS_PER_HOUR = 3_600;
    private static final long SECONDS_PER_DAY = 24 * SECONDS_PER_HOUR;
    private static final long SECONDS_PER_WEEK = 7 * SECONDS_PER_DAY;
    private static final long SECONDS_PER_MONTH = 30 * SECONDS_PER_DAY;
    private static final long SECONDS_PER_YEAR = 365 * SECONDS_PER_DAY;

    private final Duration duration;
    private final int days;
    private final int weeks;
    private final int months;
    private final int years;
    private final FrequencyUnit unit;

    private Frequency(Duration duration, int days, int weeks, int months, int years, FrequencyUnit unit) {
        this.duration = duration;
        this.days = days;
        this.weeks = weeks;
        this.months = months;
        this.years = years;
        this.unit = unit;
    }

    public static Frequency ofSeconds(long seconds) {
        return nonZero(new Frequency(Duration.ofSeconds(seconds), 0, 0, 0, 0, FrequencyUnit.SECONDS));
    }

    public static Frequency ofMinutes(long minutes) {
        return nonZero(new Frequency(Duration.ofMinutes(minutes), 0, 0, 0, 0, FrequencyUnit.MINUTES));
    }

    public static Frequency ofHours(long hours) {
        return nonZero(new Frequency(Duration.ofHours(hours), 0, 0, 0, 0, FrequencyUnit.HOURS));
    }

    public static Frequency ofDays(int days) {
        return nonZero(new Frequency(Duration.ZERO, days, 0, 0, 0, FrequencyUnit.DAYS));
    }

    public static Frequency ofWeeks(int weeks) {
        return nonZero(new Frequency(Duration.ZERO, 0, weeks, 0, 0, FrequencyUnit.WEEKS));
    }

    public static Frequency ofMonths(int months) {
        return nonZero(new Frequency(Duration.ZERO, 0, 0, months, 0, FrequencyUnit.MONTHS));
    }

    public static Frequency ofYears(int years) {
        return nonZero(new Frequency(Duration.ZERO, 0, 0, 0, years, FrequencyUnit.YEARS));
    }

    /**
     * Sub-second frequency for fine-grained polling. There is no textual form that parses back to it.
     */
    public static Frequency ofMillis(long millis) {
        return nonZero(new Frequency(Duration.ofMillis(millis), 0, 0, 0, 0, FrequencyUnit.MILLISECONDS));
    }

    /**
     * Parses {@code -?[0-9]+(s|m|mo|h|d|w|y)}.
     *
     * Rejected: empty input, missing digits or unit, fractions, unknown units, anything after the unit
     * (so "1h30m" fails), a zero magnitude, and s/m/h values reaching 24h (use days instead).
     *
     * @throws InvalidFrequencyException on any malformed input
     */
    public static Frequency parse(String text) {
        if (text == null || text.length() < 2) {
            throw new InvalidFrequencyException(text);
        }

        int i = 0;
        boolean negative = false;
        if (text.charAt(i) == '-') {
            negative = true;
            i++;
        }

        int start = i;
        while (i < text.length() && isDigit(text.charAt(i))) {
            i++;
        }
        if (i >= text.length() || i == start) {
            throw new InvalidFrequencyException(text);
        }

        long n;
        try {
            n = Long.parseLong(text.substring(start, i));
        } catch (NumberFormatException ex) {
            throw new InvalidFrequencyException(text, ex);
        }

        FrequencyUnit unit;
        switch (text.charAt(i)) {
            case 'm' -> {
                if (i + 1 < text.length() && text.charAt(i + 1) == 'o') {
                    unit = FrequencyUnit.MONTHS;
                    i++;
                } else {
                    unit = FrequencyUnit.MINUTES;
                }
            }
            case 's' -> unit = FrequencyUnit.SECONDS;
            case 'h' -> unit = FrequencyUnit.HOURS;
            case 'd' -> unit = FrequencyUnit.DAYS;
            case 'w' -> unit = FrequencyUnit.WEEKS;
            case 'y' -> unit = FrequencyUnit.YEARS;
            default -> throw new InvalidFrequencyException(text);
        }
        if (i + 1 < text.length()) {
            throw new InvalidFrequencyException(text);
        }
        if (n == 0) {
            throw new InvalidFrequencyException(text);
        }

        long magnitude = negative ? -n : n;
        return switch (unit) {
            case SECONDS -> subDay(text, n, 1, Duration.ofSeconds(magnitude), unit);
            case MINUTES -> subDay(text, n, SECONDS_PER_MINUTE, Duration.ofMinutes(magnitude), unit);
            case HOURS -> subDay(text, n, SECONDS_PER_HOUR, Duration.ofHours(magnitude), unit);
            case DAYS -> new Frequency(Duration.ZERO, toInt(text, magnitude), 0, 0, 0, unit);
            case WEEKS -> new Frequency(Duration.ZERO, 0, toInt(text, magnitude), 0, 0, unit);
            case MONTHS -> new Frequency(Duration.ZERO, 0, 0, toInt(text, magnitude), 0, unit);
            case YEARS -> new Frequency(Duration.ZERO, 0, 0, 0, toInt(text, magnitude), unit);
            default -> throw new InvalidFrequencyException(text);
        };
    }

    /**
     * JSON entry point: the inverse of {@link #toString()}, so an empty string reads back as {@link #NONE}.
     */
    @JsonCreator
    static Frequency fromJson(String text) {
        if (text == null || text.isBlank()) {
            return NONE;
        }
        return parse(text);
    }

    /**
     * Picks the coarsest unit that divides the duration exactly, checked in the order
     * years (365d), months (30d), weeks, days, hours, minutes. Anything else is truncated to whole seconds.
     * Positive durations under one second become "1s".
     *
     * @throws InvalidFrequencyException for null, zero or negative durations, and for calendar
     *                                     magnitudes that do not fit an int
     */
    public static Frequency fromDuration(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            throw new InvalidFrequencyException(String.valueOf(d));
        }

        String text = d.toString();
        long seconds = d.getSeconds();
        if (seconds == 0) {
            return new Frequency(Duration.ofSeconds(1), 0, 0, 0, 0, FrequencyUnit.SECONDS);
        }
        if (seconds % SECONDS_PER_YEAR == 0) {
            return new Frequency(Duration.ZERO, 0, 0, 0, toInt(text, seconds / SECONDS_PER_YEAR), FrequencyUnit.YEARS);
        }
        if (seconds % SECONDS_PER_MONTH == 0) {
            return new Frequency(Duration.ZERO, 0, 0, toInt(text, seconds / SECONDS_PER_MONTH), 0, FrequencyUnit.MONTHS);
        }
        if (seconds % SECONDS_PER_WEEK == 0) {
            return new Frequency(Duration.ZERO, 0, toInt(text, seconds / SECONDS_PER_WEEK), 0, 0, FrequencyUnit.WEEKS);
        }
        if (seconds % SECONDS_PER_DAY == 0) {
            return new Frequency(Duration.ZERO, toInt(text, seconds / SECONDS_PER_DAY), 0, 0, 0, FrequencyUnit.DAYS);
        }
        if (seconds % SECONDS_PER_HOUR == 0) {
            return new Frequency(Duration.ofSeconds(seconds), 0, 0, 0, 0, FrequencyUnit.HOURS);
        }
        if (seconds % SECONDS_PER_MINUTE == 0) {
            return new Frequency(Duration.ofSeconds(seconds), 0, 0, 0, 0, FrequencyUnit.MINUTES);
        }
        return new Frequency(Duration.ofSeconds(seconds), 0, 0, 0, 0, FrequencyUnit.SECONDS);
    }

    /**
     * Magnitude in {@link #getUnit()}. Sub-day values are derived from the stored duration and rounded
     * half away from zero.
     */
    public long getValue() {
        if (unit == null) {
            return 0;
        }
        return switch (unit) {
            case MILLISECONDS -> duration.toMillis();
            case SECONDS -> roundedIn(1);
            case MINUTES -> roundedIn(SECONDS_PER_MINUTE);
            case HOURS -> roundedIn(SECONDS_PER_HOUR);
            case DAYS -> days;
            case WEEKS -> weeks;
            case MONTHS -> months;
            case YEARS -> years;
        };
    }

    public boolean isZero() {
        return duration.isZero() && days == 0 && weeks == 0 && months == 0 && years == 0;
    }

    /** True when the frequency carries a fixed sub-day duration rather than calendar fields. */
    public boolean isSubDay() {
        return !duration.isZero();
    }

    /**
     * Adds the fixed duration on the instant time-line, then years / months / (weeks * 7 + days) on the
     * calendar. Day-of-month overflow rolls forward: 2021-01-31 plus one month is 2021-03-03.
     */
    public ZonedDateTime nextRun(ZonedDateTime lastRun) {
        ZonedDateTime shifted = lastRun.plus(duration);
        if (years == 0 && months == 0 && weeks == 0 && days == 0) {
            return shifted;
        }

        long totalMonths = shifted.getYear() * 12L + (shifted.getMonthValue() - 1) + years * 12L + months;
        int year = Math.toIntExact(Math.floorDiv(totalMonths, 12L));
        int month = (int) Math.floorMod(totalMonths, 12L) + 1;
        LocalDate date = LocalDate.of(year, month, 1)
                .plusDays(shifted.getDayOfMonth() - 1L + weeks * 7L + days);

        return ZonedDateTime.of(date, shifted.toLocalTime(), shifted.getZone());
    }

    public Instant nextRun(Instant lastRun, ZoneId zone) {
        return nextRun(lastRun.atZone(zone)).toInstant();
    }

    /**
     * Returns true if the next run time has NOT yet elapsed, i.e. {@code nextRun(lastRun)} is strictly
     * after {@code currentTime}. The name reads the other way round; the behaviour is kept as is.
     * Use {@link #hasElapsed(ZonedDateTime, ZonedDateTime)} for the "is due" question.
     */
    public boolean shouldRun(ZonedDateTime lastRun, ZonedDateTime currentTime) {
        return nextRun(lastRun).isAfter(currentTime);
    }

    public boolean shouldRun(Instant lastRun, Instant currentTime, ZoneId zone) {
        return shouldRun(lastRun.atZone(zone), currentTime.atZone(zone));
    }

    /** Complement of {@link #shouldRun(ZonedDateTime, ZonedDateTime)}: the next run time has been reached. */
    public boolean hasElapsed(ZonedDateTime lastRun, ZonedDateTime currentTime) {
        return !shouldRun(lastRun, currentTime);
    }

    public boolean hasElapsed(Instant lastRun, Instant currentTime, ZoneId zone) {
        return !shouldRun(lastRun, currentTime, zone);
    }

    @JsonValue
    @Override
    public String toString() {
        if (unit == null) {
            return "";
        }
        return getValue() + unit.token();
    }

    private static Frequency subDay(String text, long n, long unitSeconds, Duration duration, FrequencyUnit unit) {
        if (n >= SECONDS_PER_DAY / unitSeconds) {
            throw new InvalidFrequencyException(text);
        }
        return new Frequency(duration, 0, 0, 0, 0, unit);
    }

    private static int toInt(String text, long value) {
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new InvalidFrequencyException(text);
        }
        return (int) value;
    }

    private static Frequency nonZero(Frequency f) {
        if (f.isZero()) {
            throw new InvalidFrequencyException(f.getValue() + f.unit.token());
        }
        return f;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    // exact for any Duration; toNanos() overflows past ~292 years
    private long roundedIn(long unitSeconds) {
        return BigDecimal.valueOf(duration.getSeconds())
                .add(BigDecimal.valueOf(duration.getNano(), 9))
                .divide(BigDecimal.valueOf(unitSeconds), 0, RoundingMode.HALF_UP)
                .longValueExact();
    }
}
