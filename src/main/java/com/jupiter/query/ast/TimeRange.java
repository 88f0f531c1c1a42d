package com.jupiter.query.ast;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Time window of a query: either absolute bounds ({@code start} and/or
 * {@code end}) or a relative window ({@code last}, e.g. {@code 15m},
 * {@code 1h}, {@code 7d}) resolved against the current clock at execution or
 * compile time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TimeRange {

    private static final Pattern RELATIVE_PATTERN = Pattern.compile("^(\\d+)([mhd])$");

    // longest window whose cutoff is representable for any clock after the epoch
    private static final Duration MAX_WINDOW = Duration.between(Instant.MIN, Instant.EPOCH);

    private final Instant start;
    private final Instant end;
    private final String last;

    @JsonCreator
    public TimeRange(@JsonProperty("start") Instant start,
                     @JsonProperty("end") Instant end,
                     @JsonProperty("last") String last) {
        this.start = start;
        this.end = end;
        this.last = last;
    }

    public static TimeRange between(Instant start, Instant end) {
        return new TimeRange(start, end, null);
    }

    public static TimeRange last(String duration) {
        return new TimeRange(null, null, duration);
    }

    @JsonProperty("start")
    public Instant getStart() {
        return start;
    }

    @JsonProperty("end")
    public Instant getEnd() {
        return end;
    }

    @JsonProperty("last")
    public String getLast() {
        return last;
    }

    @JsonIgnore
    public boolean isRelative() {
        return last != null;
    }

    /**
     * Parse the relative window. Empty when {@code last} is absent or does not
     * match {@code <N>m}, {@code <N>h} or {@code <N>d} with a positive N, or
     * when the window is too long to resolve.
     */
    @JsonIgnore
    public Optional<Duration> getRelativeDuration() {
        if (last == null) {
            return Optional.empty();
        }
        Matcher matcher = RELATIVE_PATTERN.matcher(last.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        long amount;
        try {
            amount = Long.parseLong(matcher.group(1));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        if (amount <= 0) {
            return Optional.empty();
        }
        Duration duration;
        try {
            duration = switch (matcher.group(2)) {
                case "m" -> Duration.ofMinutes(amount);
                case "h" -> Duration.ofHours(amount);
                default -> Duration.ofDays(amount);
            };
        } catch (ArithmeticException e) {
            return Optional.empty();
        }
        return duration.compareTo(MAX_WINDOW) > 0 ? Optional.empty() : Optional.of(duration);
    }

    /**
     * Lower bound implied by the relative window, computed against the clock.
     * Empty when the window reaches before {@link Instant#MIN}.
     */
    public Optional<Instant> resolveCutoff(Clock clock) {
        Optional<Duration> duration = getRelativeDuration();
        if (duration.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(clock.instant().minus(duration.get()));
        } catch (DateTimeException | ArithmeticException e) {
            return Optional.empty();
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange)) return false;
        TimeRange other = (TimeRange) o;
        return Objects.equals(start, other.start) && Objects.equals(end, other.end)
            && Objects.equals(last, other.last);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, last);
    }

    @Override
    public String toString() {
        return last != null ? "last " + last : "[" + start + ", " + end + "]";
    }
}
