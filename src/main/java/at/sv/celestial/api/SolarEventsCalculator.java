package at.sv.celestial.api;

import at.sv.celestial.event.SolarAbsoluteEventDay;
import at.sv.celestial.event.SolarRelativeEventDay;
import at.sv.celestial.event.UpcomingShortEvent;
import at.sv.celestial.magic.MagicHourPeriod;
import at.sv.celestial.position.Twilight;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;

/**
 * Sunrise, sunset, twilight and magic hour for a location. All methods throw
 * {@link at.sv.celestial.InvalidArgument} for a latitude outside [-90,90] or a longitude outside [-180,180].
 */
public interface SolarEventsCalculator {

    /**
     * @return the events of the civil day containing {@code dateTime}, relative to {@code dateTime}
     */
    SolarRelativeEventDay calculateSolarEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    SolarAbsoluteEventDay calculateSolarAbsoluteEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    /**
     * Same as {@link #calculateSolarAbsoluteEventDay(double, double, ZonedDateTime)} but for the given Sun altitude,
     * e.g. the start and end of civil twilight. {@code POLAR_DAY} then means the Sun stays above that altitude.
     */
    SolarAbsoluteEventDay calculateSolarAbsoluteEventDay(double latitude, double longitude, ZonedDateTime dateTime,
                                                         Twilight twilight);

    /**
     * @return the first day, starting with the day of {@code dateTime}, that has an event at or after
     * {@code dateTime}. Only the remaining events are contained.
     */
    SolarAbsoluteEventDay findUpcomingSolarAbsoluteEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    SolarRelativeEventDay findUpcomingSolarRelativeEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    /**
     * @return the next sunrise or sunset at or after {@code dateTime}, or {@code null} if there is none within a year
     */
    @Nullable
    UpcomingShortEvent findUpcomingSolarRelativeShortEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    MagicHourPeriod calculateMagicHourPeriod(double latitude, double longitude, ZonedDateTime dateTime);
}
