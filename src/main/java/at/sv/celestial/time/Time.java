package at.sv.celestial.time;

import at.sv.celestial.InvalidArgument;

import java.time.LocalTime;
import java.util.Locale;

/**
 * A clock time with an optional signed day offset. Used both for the time of day of an event and for durations
 * such as the length of a day, in which case {@code days} carries the whole days of the span.
 */
public record Time(int days, int hour, int min, int sec, int millis) implements Comparable<Time> {

    public static final long MILLIS_PER_SECOND = 1000L;
    public static final long MILLIS_PER_MINUTE = 60 * MILLIS_PER_SECOND;
    public static final long MILLIS_PER_HOUR = 60 * MILLIS_PER_MINUTE;
    public static final long MILLIS_PER_DAY = 24 * MILLIS_PER_HOUR;

    public static final Time ZERO = new Time(0, 0);

    public Time {
        if (hour < 0 || hour > 23) {
            throw new InvalidArgument("Hour must be between 0 and 23. Provided value: " + hour);
        }
        if (min < 0 || min > 59) {
            throw new InvalidArgument("Minute must be between 0 and 59. Provided value: " + min);
        }
        if (sec < 0 || sec > 59) {
            throw new InvalidArgument("Second must be between 0 and 59. Provided value: " + sec);
        }
        if (millis < 0 || millis > 999) {
            throw new InvalidArgument("Millisecond must be between 0 and 999. Provided value: " + millis);
        }
    }

    public Time(int hour, int min) {
        this(0, hour, min, 0, 0);
    }

    public Time(int hour, int min, int sec) {
        this(0, hour, min, sec, 0);
    }

    public static Time ofDays(int days, int hour, int min) {
        return new Time(days, hour, min, 0, 0);
    }

    /**
     * Normalizes the given amount of milliseconds with floor semantics, i.e. negative values produce a negative
     * day offset and a positive clock time: {@code -3_661_000} becomes {@code days=-1, 22:58:59}.
     */
    public static Time fromTotalMilliseconds(long totalMillis) {
        long days = Math.floorDiv(totalMillis, MILLIS_PER_DAY);
        long rest = Math.floorMod(totalMillis, MILLIS_PER_DAY);
        int hour = (int) (rest / MILLIS_PER_HOUR);
        rest %= MILLIS_PER_HOUR;
        int min = (int) (rest / MILLIS_PER_MINUTE);
        rest %= MILLIS_PER_MINUTE;
        int sec = (int) (rest / MILLIS_PER_SECOND);
        int millis = (int) (rest % MILLIS_PER_SECOND);
        return new Time(Math.toIntExact(days), hour, min, sec, millis);
    }

    public static Time of(LocalTime localTime) {
        return new Time(0, localTime.getHour(), localTime.getMinute(), localTime.getSecond(),
                localTime.getNano() / 1_000_000);
    }

    public long toTotalMilliseconds() {
        return days * MILLIS_PER_DAY + hour * MILLIS_PER_HOUR + min * MILLIS_PER_MINUTE + sec * MILLIS_PER_SECOND + millis;
    }

    /**
     * @return the whole minutes of this time, rounded towards negative infinity
     */
    public long toTotalMinutes() {
        return Math.floorDiv(toTotalMilliseconds(), MILLIS_PER_MINUTE);
    }

    /**
     * @return the clock part of this time, ignoring the day offset
     */
    public LocalTime toLocalTime() {
        return LocalTime.of(hour, min, sec, millis * 1_000_000);
    }

    @Override
    public int compareTo(Time other) {
        return Long.compare(toTotalMilliseconds(), other.toTotalMilliseconds());
    }

    @Override
    public String toString() {
        String clock = String.format(Locale.ROOT, "%02d:%02d:%02d", hour, min, sec);
        if (days == 0) {
            return clock;
        }
        return days + "d " + clock;
    }
}
