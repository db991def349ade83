package at.sv.celestial.api;

import at.sv.celestial.event.LunarAbsoluteEventDay;
import at.sv.celestial.event.LunarRelativeEventDay;

import java.time.ZonedDateTime;

/**
 * Moonrise, moonset and the phase of the Moon for a location. Age and illumination always refer to the query
 * instant.
 */
public interface LunarEventsCalculator {

    LunarRelativeEventDay calculateLunarEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    LunarAbsoluteEventDay calculateLunarAbsoluteEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    LunarRelativeEventDay findUpcomingLunarRelativeEventDay(double latitude, double longitude, ZonedDateTime dateTime);

    LunarAbsoluteEventDay findUpcomingLunarAbsoluteEventDay(double latitude, double longitude, ZonedDateTime dateTime);
}
