package at.sv.celestial.time;

import at.sv.celestial.InvalidArgument;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.lessThan;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeTest {

    @Test
    void fromTotalMilliseconds_negative_floorsToPreviousDay() {
        Time time = Time.fromTotalMilliseconds(-3_661_000);

        assertThat(time.days(), is(-1));
        assertThat(time.hour(), is(22));
        assertThat(time.min(), is(58));
        assertThat(time.sec(), is(59));
        assertThat(time.millis(), is(0));
        assertThat(time.toTotalMilliseconds(), is(-3_661_000L));
        assertThat(time.toTotalMinutes(), is(-62L));
    }

    @Test
    void fromTotalMilliseconds_fullDay_usesDayOffset() {
        Time time = Time.fromTotalMilliseconds(Time.MILLIS_PER_DAY + 1);

        assertThat(time, is(new Time(1, 0, 0, 0, 1)));
        assertThat(time.toString(), is("1d 00:00:00"));
    }

    @Test
    void roundTrip_throughTotalMilliseconds() {
        for (long millis : new long[]{0, 1, 59_999, 3_600_000, 86_399_999, 172_800_123, -1, -86_400_001}) {
            assertThat(Time.fromTotalMilliseconds(millis).toTotalMilliseconds(), is(millis));
        }
    }

    @Test
    void of_localTime_keepsMillis() {
        Time time = Time.of(LocalTime.of(6, 4, 7, 123_456_789));

        assertThat(time, is(new Time(0, 6, 4, 7, 123)));
        assertThat(time.toLocalTime(), is(LocalTime.of(6, 4, 7, 123_000_000)));
        assertThat(time.toString(), is("06:04:07"));
    }

    @Test
    void compareTo_usesTotalDuration() {
        assertThat(new Time(6, 0), lessThan(new Time(6, 1)));
        assertThat(new Time(6, 0), greaterThan(Time.ZERO));
        assertThat(new Time(23, 59, 59), lessThan(Time.ofDays(1, 0, 0)));
    }

    @Test
    void invalidFields_throwInvalidArgument() {
        InvalidArgument exception = assertThrows(InvalidArgument.class, () -> new Time(25, 0));
        assertThat(exception.getMessage(), containsString("25"));

        assertThrows(InvalidArgument.class, () -> new Time(-1, 0));
        assertThrows(InvalidArgument.class, () -> new Time(10, 60));
        assertThrows(InvalidArgument.class, () -> new Time(10, 0, 60));
        assertThrows(InvalidArgument.class, () -> new Time(0, 10, 0, 0, 1000));
    }
}
