package at.sv.celestial.magic;

import at.sv.celestial.Coordinate;
import at.sv.celestial.position.Sun;
import at.sv.celestial.solver.HorizonCrossingSolver;
import at.sv.celestial.time.Time;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MagicHourSegmenterTest {

    private static final Coordinate BERLIN = Coordinate.of(52.52, 13.40);
    private static final Coordinate NEAR_POLE = Coordinate.of(89.9, 0.0);

    private MagicHourSegmenter segmenter;

    private static long totalMillis(MagicHourPeriod period) {
        long intervals = period.events().stream().map(EventTrack::duration).mapToLong(Duration::toMillis).sum();
        return period.daylight().toTotalMilliseconds() + period.darkness().toTotalMilliseconds() + intervals;
    }

    @BeforeEach
    void setUp() {
        segmenter = new MagicHourSegmenter(new Sun(), new HorizonCrossingSolver());
    }

    @Test
    void berlinSummer_morningAndEveningInterval() {
        ZonedDateTime dayStart = ZonedDateTime.of(2024, 7, 1, 0, 0, 0, 0, ZoneId.of("Europe/Berlin"));

        MagicHourPeriod period = segmenter.segment(BERLIN, dayStart);

        assertThat(totalMillis(period)).isEqualTo(Time.MILLIS_PER_DAY);
        assertThat(period.events()).hasSize(2);
        assertThat(period.events()).allSatisfy(track -> {
            assertThat(track.typeEventTrack()).isEqualTo(TypeEventTrack.MAGIC_HOUR);
            assertThat(track.start().azimuth()).isNotNull();
            assertThat(track.finish().azimuth()).isNotNull();
            assertThat(track.start().dateTime()).isBefore(track.finish().dateTime());
            assertThat(track.start().dateTime()).isEqualTo(track.start().dateTime().truncatedTo(ChronoUnit.MILLIS));
        });
        EventTrack morning = period.events().get(0);
        EventTrack evening = period.events().get(1);
        assertThat(morning.start().dateTime().toLocalTime()).isBetween(LocalTime.of(4, 0), LocalTime.of(5, 0));
        assertThat(morning.start().azimuth()).isBetween(20.0, 80.0);
        assertThat(evening.finish().dateTime().toLocalTime()).isBetween(LocalTime.of(21, 30), LocalTime.of(22, 30));
        assertThat(period.daylight().toTotalMilliseconds()).isGreaterThan(12 * Time.MILLIS_PER_HOUR);
        assertThat(period.darkness().toTotalMilliseconds()).isPositive();
    }

    @Test
    void sumOfDurations_alwaysFullDay() {
        ZonedDateTime dayStart = ZonedDateTime.of(2025, 1, 1, 0, 0, 0, 0, ZoneId.of("Asia/Tokyo"));
        for (int day = 0; day < 365; day += 29) {
            MagicHourPeriod period = segmenter.segment(Coordinate.of(35.68, 139.76), dayStart.plusDays(day));

            assertThat(totalMillis(period)).isEqualTo(Time.MILLIS_PER_DAY);
            assertThat(period.events()).isSortedAccordingTo(
                    (a, b) -> a.start().dateTime().compareTo(b.start().dateTime()));
        }
    }

    @Test
    void nearPoleAtEquinox_wholeDayInsideBand() {
        ZonedDateTime dayStart = ZonedDateTime.of(2025, 3, 17, 0, 0, 0, 0, ZoneId.of("UTC"));

        MagicHourPeriod period = segmenter.segment(NEAR_POLE, dayStart);

        assertThat(period.events()).hasSize(1);
        EventTrack track = period.events().get(0);
        assertThat(track.start().dateTime()).isEqualTo(dayStart);
        assertThat(track.finish().dateTime()).isEqualTo(dayStart.plusDays(1));
        assertThat(track.start().azimuth()).isNull();
        assertThat(track.finish().azimuth()).isNull();
        assertThat(period.daylight()).isEqualTo(Time.ZERO);
        assertThat(period.darkness()).isEqualTo(Time.ZERO);
    }

    @Test
    void nearPoleInSummer_noMagicHour_onlyDaylight() {
        ZonedDateTime dayStart = ZonedDateTime.of(2025, 6, 21, 0, 0, 0, 0, ZoneId.of("UTC"));

        MagicHourPeriod period = segmenter.segment(NEAR_POLE, dayStart);

        assertThat(period.events()).isEmpty();
        assertThat(period.daylight().toTotalMilliseconds()).isEqualTo(Time.MILLIS_PER_DAY);
        assertThat(period.darkness()).isEqualTo(Time.ZERO);
    }

    @Test
    void nearPoleInWinter_noMagicHour_onlyDarkness() {
        ZonedDateTime dayStart = ZonedDateTime.of(2025, 12, 21, 0, 0, 0, 0, ZoneId.of("UTC"));

        MagicHourPeriod period = segmenter.segment(NEAR_POLE, dayStart);

        assertThat(period.events()).isEmpty();
        assertThat(period.darkness().toTotalMilliseconds()).isEqualTo(Time.MILLIS_PER_DAY);
        assertThat(period.daylight()).isEqualTo(Time.ZERO);
    }

    @Test
    void sameInput_equalResults() {
        ZonedDateTime dayStart = ZonedDateTime.of(2024, 10, 5, 0, 0, 0, 0, ZoneId.of("Europe/Berlin"));

        assertThat(segmenter.segment(BERLIN, dayStart)).isEqualTo(segmenter.segment(BERLIN, dayStart));
    }
}
