package at.sv.celestial.position;

import static at.sv.celestial.position.Angles.cosDeg;
import static at.sv.celestial.position.Angles.normalizeDegrees;
import static at.sv.celestial.position.Angles.sinDeg;

/**
 * Geocentric apparent place of a body.
 *
 * @param rightAscension        degrees [0, 360)
 * @param declination           degrees [-90, 90]
 * @param eclipticLongitude     apparent ecliptic longitude in degrees [0, 360)
 * @param distanceKm            distance from the center of the Earth in kilometers
 * @param greenwichSiderealTime apparent sidereal time at Greenwich for the same instant, in degrees
 */
public record EquatorialCoordinate(double rightAscension, double declination, double eclipticLongitude,
                                   double distanceKm, double greenwichSiderealTime) {

    /**
     * Rotates ecliptic coordinates into the equatorial frame (Meeus 13.3 and 13.4).
     */
    static EquatorialCoordinate fromEcliptic(double longitude, double latitude, double distanceKm, double obliquity,
                                             double greenwichSiderealTime) {
        double rightAscension = Math.toDegrees(Math.atan2(
                sinDeg(longitude) * cosDeg(obliquity) - Math.tan(Math.toRadians(latitude)) * sinDeg(obliquity),
                cosDeg(longitude)));
        double declination = Math.toDegrees(Math.asin(
                sinDeg(latitude) * cosDeg(obliquity) + cosDeg(latitude) * sinDeg(obliquity) * sinDeg(longitude)));
        return new EquatorialCoordinate(normalizeDegrees(rightAscension), declination, normalizeDegrees(longitude),
                distanceKm, greenwichSiderealTime);
    }
}
