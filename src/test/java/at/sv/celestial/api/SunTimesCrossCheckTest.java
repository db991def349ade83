package at.sv.celestial.api;

import at.sv.celestial.event.EventType;
import at.sv.celestial.event.SolarAbsoluteEventDay;
import at.sv.celestial.event.UpcomingAbsoluteEvent;
import at.sv.celestial.position.Twilight;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.shredzone.commons.suncalc.SunTimes;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Compares the calculated times against the commons-suncalc library.
 */
class SunTimesCrossCheckTest {

    private static final double LAT = 48.20;
    private static final double LONG = 16.39;
    private static final Duration TOLERANCE = Duration.ofMinutes(2);

    private ZonedDateTime dateTime;
    private SolarEventsCalculator calculator;

    private static ZonedDateTime eventOf(SolarAbsoluteEventDay day, EventType type) {
        return day.events().stream()
                  .filter(event -> event.type() == type)
                  .map(UpcomingAbsoluteEvent::dateTime)
                  .findFirst()
                  .orElseThrow();
    }

    private static void assertClose(ZonedDateTime actual, ZonedDateTime expected) {
        assertThat(Duration.between(expected, actual).abs())
                .as("%s differs from %s", actual, expected)
                .isLessThanOrEqualTo(TOLERANCE);
    }

    private void assertMatchesSunCalc(Twilight twilight, SunTimes.Twilight sunCalcTwilight) {
        SolarAbsoluteEventDay day = calculator.calculateSolarAbsoluteEventDay(LAT, LONG, dateTime, twilight);
        SunTimes sunTimes = SunTimes.compute().at(LAT, LONG).on(dateTime.with(LocalTime.MIDNIGHT))
                                    .twilight(sunCalcTwilight).execute();

        assertClose(eventOf(day, EventType.RISE), sunTimes.getRise());
        assertClose(eventOf(day, EventType.SET), sunTimes.getSet());
    }

    @BeforeEach
    void setUp() {
        dateTime = ZonedDateTime.of(2021, 1, 1, 0, 0, 0, 0, ZoneId.of("Europe/Vienna"));
        calculator = new SolarEventsCalculatorImpl();
    }

    @Test
    void sunriseAndSunset_matchSunCalc_overTheYear() {
        for (int month = 1; month <= 12; month++) {
            dateTime = dateTime.withMonth(month).withDayOfMonth(15);
            assertMatchesSunCalc(Twilight.VISUAL, SunTimes.Twilight.VISUAL);
        }
    }

    @Test
    void twilight_matchesSunCalc() {
        assertMatchesSunCalc(Twilight.CIVIL, SunTimes.Twilight.CIVIL);
        assertMatchesSunCalc(Twilight.NAUTICAL, SunTimes.Twilight.NAUTICAL);
        assertMatchesSunCalc(Twilight.ASTRONOMICAL, SunTimes.Twilight.ASTRONOMICAL);
        dateTime = dateTime.withMonth(9).withDayOfMonth(23);
        assertMatchesSunCalc(Twilight.CIVIL, SunTimes.Twilight.CIVIL);
        assertMatchesSunCalc(Twilight.GOLDEN_HOUR, SunTimes.Twilight.GOLDEN_HOUR);
        assertMatchesSunCalc(Twilight.BLUE_HOUR, SunTimes.Twilight.BLUE_HOUR);
    }

    @Test
    void meridianCrossing_matchesSolarNoon() {
        SolarAbsoluteEventDay day = calculator.calculateSolarAbsoluteEventDay(LAT, LONG, dateTime);
        SunTimes sunTimes = SunTimes.compute().at(LAT, LONG).on(dateTime).execute();

        assertThat(day.meridianCrossing()).isNotNull();
        LocalTime noon = sunTimes.getNoon().toLocalTime();
        assertThat(Duration.between(noon, day.meridianCrossing().toLocalTime()).abs())
                .isLessThanOrEqualTo(Duration.ofMinutes(1));
        // 11:58:13
        assertThat(Duration.between(LocalTime.of(11, 58, 13), day.meridianCrossing().toLocalTime()).abs())
                .isLessThanOrEqualTo(Duration.ofMinutes(1));
    }
}
