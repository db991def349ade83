package at.sv.celestial.position;

import at.sv.celestial.Coordinate;
import at.sv.celestial.time.JulianDate;

/**
 * The capability shared by the Sun and the Moon: a position for every instant and the altitude its center has to
 * cross to count as rising or setting.
 */
public interface CelestialBody {

    /**
     * @param julianDate Julian Date of Universal Time
     */
    EquatorialCoordinate equatorial(double julianDate);

    /**
     * @param position the body's place at the instant the threshold is needed for
     * @return the geocentric altitude in degrees at which the body rises or sets
     */
    double thresholdAltitude(EquatorialCoordinate position);

    default HorizontalCoordinate horizontal(Coordinate observer, long epochMillis) {
        return HorizontalTransform.toHorizontal(equatorial(JulianDate.ofEpochMillis(epochMillis)), observer);
    }

    /**
     * @return the altitude above the rise/set threshold in degrees; positive while the body is up
     */
    default double altitudeAboveThreshold(Coordinate observer, long epochMillis) {
        EquatorialCoordinate position = equatorial(JulianDate.ofEpochMillis(epochMillis));
        return HorizontalTransform.toHorizontal(position, observer).altitude() - thresholdAltitude(position);
    }
}
