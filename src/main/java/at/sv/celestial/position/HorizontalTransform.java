package at.sv.celestial.position;

import at.sv.celestial.Coordinate;
import at.sv.celestial.time.SiderealTime;

import static at.sv.celestial.position.Angles.cosDeg;
import static at.sv.celestial.position.Angles.normalizeDegrees;
import static at.sv.celestial.position.Angles.normalizeSignedDegrees;
import static at.sv.celestial.position.Angles.sinDeg;

/**
 * Turns a geocentric equatorial place into altitude and azimuth for an observer (Meeus 13.5 and 13.6).
 */
public final class HorizontalTransform {
    private HorizontalTransform() {
    }

    public static HorizontalCoordinate toHorizontal(EquatorialCoordinate position, Coordinate observer) {
        double localSiderealTime = SiderealTime.local(position.greenwichSiderealTime(), observer.longitude());
        double hourAngle = normalizeSignedDegrees(localSiderealTime - position.rightAscension());
        double latitude = observer.latitude();
        double declination = position.declination();

        double sinAltitude = sinDeg(latitude) * sinDeg(declination)
                             + cosDeg(latitude) * cosDeg(declination) * cosDeg(hourAngle);
        double altitude = Math.toDegrees(Math.asin(Math.max(-1.0, Math.min(1.0, sinAltitude))));
        double azimuthFromSouth = Math.toDegrees(Math.atan2(sinDeg(hourAngle),
                cosDeg(hourAngle) * sinDeg(latitude) - Math.tan(Math.toRadians(declination)) * cosDeg(latitude)));
        return new HorizontalCoordinate(altitude, normalizeDegrees(azimuthFromSouth + 180.0), hourAngle);
    }
}
