package com.github.dimitryivaniuta.scheduling.frequency;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrequencyTest {

    private static final ZonedDateTime LAST_RUN = utc("2021-11-26T15:00:05.350");

    // ---------- parse ----------

    static Stream<Arguments> validTexts() {
        return Stream.of(
                Arguments.of("100s", Frequency.ofSeconds(100)),
                Arguments.of("2m", Frequency.ofMinutes(2)),
                Arguments.of("2mo", Frequency.ofMonths(2)),
                Arguments.of("2h", Frequency.ofHours(2)),
                Arguments.of("2d", Frequency.ofDays(2)),
                Arguments.of("15d", Frequency.ofDays(15)),
                Arguments.of("2w", Frequency.ofWeeks(2)),
                Arguments.of("2y", Frequency.ofYears(2)),
                Arguments.of("-5s", Frequency.ofSeconds(-5)),
                Arguments.of("-3w", Frequency.ofWeeks(-3)),
                Arguments.of("23h", Frequency.ofHours(23)),
                Arguments.of("1439m", Frequency.ofMinutes(1439)),
                Arguments.of("86399s", Frequency.ofSeconds(86399))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("validTexts")
    void shouldParseValidText(String text, Frequency expected) {
        assertThat(Frequency.parse(text)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "\"{0}\"")
    @ValueSource(strings = {
            "25h", "24h", "-25h", "1440m", "86400s",
            "1h30m", "-5m30s", "3mm", "0s", "-0d", "3", "3nm", "1000",
            "w", "ms", "-", "1.2w", "10x", "5ms", "s5", " 5s", "5s ", "99999999999d"
    })
    void shouldRejectInvalidText(String text) {
        assertThatThrownBy(() -> Frequency.parse(text))
                .isInstanceOf(InvalidFrequencyException.class)
                .hasMessageStartingWith(InvalidFrequencyException.MESSAGE);
    }

    @ParameterizedTest
    @NullAndEmptySource
    void shouldRejectMissingText(String text) {
        assertThatThrownBy(() -> Frequency.parse(text)).isInstanceOf(InvalidFrequencyException.class);
    }

    @Test
    void shouldCarryOffendingInputInException() {
        assertThatThrownBy(() -> Frequency.parse("10x"))
                .isInstanceOf(InvalidFrequencyException.class)
                .hasMessage("invalid duration: '10x'")
                .extracting(ex -> ((InvalidFrequencyException) ex).getInput())
                .isEqualTo("10x");
    }

    // ---------- format ----------

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"1s", "5m", "4h", "3d", "1w", "7mo", "2y", "100s", "2mo", "3w", "4y", "-5s"})
    void shouldPrintParsedTextBack(String text) {
        assertThat(Frequency.parse(text).toString()).isEqualTo(text);
    }

    @Test
    void shouldPrintMonthsWithMoToken() {
        assertThat(Frequency.ofMonths(1).toString()).isEqualTo("1mo");
        assertThat(Frequency.fromDuration(Duration.ofDays(60)).toString()).isEqualTo("2mo");
    }

    @Test
    void shouldPrintNoneAsEmptyText() {
        assertThat(Frequency.NONE.toString()).isEmpty();
        assertThat(Frequency.NONE.isZero()).isTrue();
        assertThat(Frequency.NONE.getValue()).isZero();
    }

    @Test
    void shouldExposeValueAndUnit() {
        Frequency f = Frequency.parse("7mo");
        assertThat(f.getValue()).isEqualTo(7);
        assertThat(f.getUnit()).isEqualTo(FrequencyUnit.MONTHS);
        assertThat(f.isSubDay()).isFalse();

        Frequency millis = Frequency.ofMillis(1500);
        assertThat(millis.getValue()).isEqualTo(1500);
        assertThat(millis.getUnit()).isEqualTo(FrequencyUnit.MILLISECONDS);
        assertThat(millis.toString()).isEqualTo("1500ms");
        assertThat(millis.isSubDay()).isTrue();
    }

    @Test
    void shouldRejectZeroFromFactories() {
        assertThatThrownBy(() -> Frequency.ofSeconds(0)).isInstanceOf(InvalidFrequencyException.class);
        assertThatThrownBy(() -> Frequency.ofMonths(0)).isInstanceOf(InvalidFrequencyException.class);
        assertThatThrownBy(() -> Frequency.ofMillis(0)).isInstanceOf(InvalidFrequencyException.class);
    }

    // ---------- fromDuration ----------

    static Stream<Arguments> durations() {
        return Stream.of(
                Arguments.of(Duration.ofSeconds(100), Frequency.ofSeconds(100)),
                Arguments.of(Duration.ofSeconds(150), Frequency.ofSeconds(150)),
                Arguments.of(Duration.ofMinutes(2), Frequency.ofMinutes(2)),
                Arguments.of(Duration.ofHours(2), Frequency.ofHours(2)),
                Arguments.of(Duration.ofHours(2).plusMillis(500), Frequency.ofHours(2)),
                Arguments.of(Duration.ofHours(25), Frequency.ofHours(25)),
                Arguments.of(Duration.ofDays(7), Frequency.ofWeeks(1)),
                Arguments.of(Duration.ofDays(8), Frequency.ofDays(8)),
                Arguments.of(Duration.ofDays(14), Frequency.ofWeeks(2)),
                Arguments.of(Duration.ofDays(30), Frequency.ofMonths(1)),
                Arguments.of(Duration.ofDays(365), Frequency.ofYears(1)),
                Arguments.of(Duration.ofDays(730), Frequency.ofYears(2)),
                Arguments.of(Duration.ofMillis(25), Frequency.ofSeconds(1))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("durations")
    void shouldPickCoarsestExactUnitForDuration(Duration duration, Frequency expected) {
        assertThat(Frequency.fromDuration(duration)).isEqualTo(expected);
    }

    @Test
    void shouldRejectNonPositiveDurations() {
        assertThatThrownBy(() -> Frequency.fromDuration(Duration.ZERO)).isInstanceOf(InvalidFrequencyException.class);
        assertThatThrownBy(() -> Frequency.fromDuration(Duration.ofSeconds(-5))).isInstanceOf(InvalidFrequencyException.class);
        assertThatThrownBy(() -> Frequency.fromDuration(null)).isInstanceOf(InvalidFrequencyException.class);
    }

    @Test
    void shouldRejectDurationWhoseCalendarMagnitudeOverflows() {
        Duration threeBillionYears = Duration.ofDays(365L * 3_000_000_000L);

        assertThatThrownBy(() -> Frequency.fromDuration(threeBillionYears))
                .isInstanceOf(InvalidFrequencyException.class);
    }

    @Test
    void shouldPrintVeryLongSubDayDurationsWithoutOverflow() {
        // more than 292 years, past what a long count of nanoseconds can hold
        Frequency seconds = Frequency.fromDuration(Duration.ofSeconds(10_000_000_001L));
        Frequency hours = Frequency.fromDuration(Duration.ofHours(3_000_001L));

        assertThat(seconds.getUnit()).isEqualTo(FrequencyUnit.SECONDS);
        assertThat(seconds.getValue()).isEqualTo(10_000_000_001L);
        assertThat(seconds.toString()).isEqualTo("10000000001s");
        assertThat(hours.toString()).isEqualTo("3000001h");
    }

    // ---------- nextRun ----------

    static Stream<Arguments> nextRuns() {
        return Stream.of(
                Arguments.of(Frequency.ofMillis(15), LAST_RUN, utc("2021-11-26T15:00:05.365")),
                Arguments.of(Frequency.parse("100s"), LAST_RUN, utc("2021-11-26T15:01:45.350")),
                Arguments.of(Frequency.parse("2m"), LAST_RUN, utc("2021-11-26T15:02:05.350")),
                Arguments.of(Frequency.parse("2h"), LAST_RUN, utc("2021-11-26T17:00:05.350")),
                Arguments.of(Frequency.parse("-5s"), LAST_RUN, utc("2021-11-26T15:00:00.350")),
                Arguments.of(Frequency.parse("2d"), LAST_RUN, utc("2021-11-28T15:00:05.350")),
                Arguments.of(Frequency.parse("3w"), LAST_RUN, utc("2021-12-17T15:00:05.350")),
                Arguments.of(Frequency.parse("1mo"), LAST_RUN, utc("2021-12-26T15:00:05.350")),
                Arguments.of(Frequency.parse("2mo"), LAST_RUN, utc("2022-01-26T15:00:05.350")),
                Arguments.of(Frequency.parse("4y"), LAST_RUN, utc("2025-11-26T15:00:05.350")),
                // day-of-month overflow rolls into the following month
                Arguments.of(Frequency.parse("1mo"), utc("2021-01-31T15:00:05.350"), utc("2021-03-03T15:00:05.350")),
                Arguments.of(Frequency.parse("1mo"), utc("2024-01-31T15:00:05.350"), utc("2024-03-02T15:00:05.350")),
                Arguments.of(Frequency.parse("1y"), utc("2020-02-29T08:00:00"), utc("2021-03-01T08:00:00")),
                Arguments.of(Frequency.parse("-1d"), utc("2021-03-01T08:00:00"), utc("2021-02-28T08:00:00"))
        );
    }

    @ParameterizedTest(name = "{0} after {1}")
    @MethodSource("nextRuns")
    void shouldComputeNextRun(Frequency frequency, ZonedDateTime lastRun, ZonedDateTime expected) {
        assertThat(frequency.nextRun(lastRun)).isEqualTo(expected);
    }

    @Test
    void shouldComputeNextRunForInstantsInGivenZone() {
        Instant last = Instant.parse("2021-01-31T23:30:00Z");
        ZoneId warsaw = ZoneId.of("Europe/Warsaw");

        // 2021-02-01T00:30 local, so one month later is 2021-03-01T00:30 local
        assertThat(Frequency.parse("1mo").nextRun(last, warsaw)).isEqualTo(Instant.parse("2021-02-28T23:30:00Z"));
        // in UTC the same instant is still January 31st and overflows
        assertThat(Frequency.parse("1mo").nextRun(last, ZoneOffset.UTC)).isEqualTo(Instant.parse("2021-03-03T23:30:00Z"));
    }

    // ---------- shouldRun / hasElapsed ----------

    static Stream<Arguments> runChecks() {
        return Stream.of(
                Arguments.of(Frequency.ofMillis(15), LAST_RUN, utc("2021-11-26T15:00:05.360"), true),
                Arguments.of(Frequency.ofMillis(15), LAST_RUN, utc("2021-11-26T15:00:05.365"), false),
                Arguments.of(Frequency.ofMillis(15), LAST_RUN, utc("2021-11-26T15:00:05.565"), false),
                Arguments.of(Frequency.parse("100s"), LAST_RUN, utc("2021-11-26T15:01:40.350"), true),
                Arguments.of(Frequency.parse("100s"), LAST_RUN, utc("2021-11-26T15:01:50.350"), false),
                Arguments.of(Frequency.parse("2d"), LAST_RUN, utc("2021-11-28T14:00:00"), true),
                Arguments.of(Frequency.parse("2d"), LAST_RUN, utc("2021-11-28T15:00:05.360"), false),
                Arguments.of(Frequency.parse("1mo"), utc("2021-01-31T15:00:05.350"), utc("2021-03-02T15:00:00"), true),
                Arguments.of(Frequency.parse("1mo"), utc("2021-01-31T15:00:05.350"), utc("2021-03-03T15:00:05.351"), false),
                Arguments.of(Frequency.parse("4y"), LAST_RUN, utc("2025-11-26T15:00:05.349"), true),
                Arguments.of(Frequency.parse("4y"), LAST_RUN, utc("2025-11-27T00:00:00"), false)
        );
    }

    @ParameterizedTest(name = "{0} last={1} now={2} -> {3}")
    @MethodSource("runChecks")
    void shouldRunOnlyWhileNextRunIsStillAhead(Frequency frequency, ZonedDateTime lastRun,
                                               ZonedDateTime now, boolean expected) {
        assertThat(frequency.shouldRun(lastRun, now)).isEqualTo(expected);
        assertThat(frequency.hasElapsed(lastRun, now)).isEqualTo(!expected);
        assertThat(frequency.shouldRun(lastRun.toInstant(), now.toInstant(), ZoneOffset.UTC)).isEqualTo(expected);
        assertThat(frequency.hasElapsed(lastRun.toInstant(), now.toInstant(), ZoneOffset.UTC)).isEqualTo(!expected);
    }

    // ---------- JSON ----------

    record Holder(Frequency every) {}

    @Test
    void shouldTravelAsJsonString() throws Exception {
        ObjectMapper om = new ObjectMapper();

        assertThat(om.writeValueAsString(Frequency.parse("2w"))).isEqualTo("\"2w\"");
        assertThat(om.writeValueAsString(new Holder(Frequency.ofMonths(1)))).isEqualTo("{\"every\":\"1mo\"}");
        assertThat(om.readValue("\"100s\"", Frequency.class)).isEqualTo(Frequency.ofSeconds(100));
        assertThat(om.readValue("{\"every\":\"3d\"}", Holder.class).every()).isEqualTo(Frequency.ofDays(3));
    }

    @Test
    void shouldReadNoneBackFromJson() throws Exception {
        ObjectMapper om = new ObjectMapper();

        String json = om.writeValueAsString(new Holder(Frequency.NONE));

        assertThat(json).isEqualTo("{\"every\":\"\"}");
        assertThat(om.readValue(json, Holder.class).every()).isSameAs(Frequency.NONE);
        assertThat(om.readValue("\"\"", Frequency.class)).isSameAs(Frequency.NONE);
    }

    @Test
    void shouldFailJsonDecodingOfInvalidText() {
        ObjectMapper om = new ObjectMapper();

        assertThatThrownBy(() -> om.readValue("{\"every\":\"5\"}", Holder.class))
                .isInstanceOf(JsonMappingException.class)
                .hasRootCauseInstanceOf(InvalidFrequencyException.class);
    }

    private static ZonedDateTime utc(String localDateTime) {
        return LocalDateTime.parse(localDateTime).atZone(ZoneOffset.UTC);
    }
}
