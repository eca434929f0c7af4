package com.github.dimitryivaniuta.scheduling.frequency;

/**
 * Unit of a {@link Frequency}. The token is the suffix used in the textual form ("2w", "1mo").
 *
 * Sub-day units are backed by a fixed {@link java.time.Duration}; day-and-larger units are
 * calendar based.
 */
public enum FrequencyUnit {
    MILLISECONDS("ms", true),
    SECONDS("s", true),
    MINUTES("m", true),
    HOURS("h", true),
    DAYS("d", false),
    WEEKS("w", false),
    MONTHS("mo", false),
    YEARS("y", false);

    private final String token;
    private final boolean subDay;

    FrequencyUnit(String token, boolean subDay) {
        this.token = token;
        this.subDay = subDay;
    }

    public String token() { return token; }

    public boolean isSubDay() { return subDay; }
}
