package at.sv.celestial.time;

import static at.sv.celestial.position.Angles.normalizeDegrees;

/**
 * Sidereal time in degrees, needed to turn right ascension into an hour angle.
 */
public final class SiderealTime {
    private SiderealTime() {
    }

    /**
     * Greenwich mean sidereal time (Meeus 12.4).
     *
     * @param julianDate Julian Date of Universal Time
     * @return the angle in degrees [0, 360)
     */
    public static double greenwichMean(double julianDate) {
        double t = JulianDate.julianCenturies(julianDate);
        double theta = 280.46061837 + 360.98564736629 * (julianDate - JulianDate.J2000)
                       + 0.000387933 * t * t - t * t * t / 38710000.0;
        return normalizeDegrees(theta);
    }

    /**
     * Greenwich apparent sidereal time, i.e. mean sidereal time corrected by the equation of the equinoxes.
     */
    public static double greenwichApparent(double julianDate, double nutationInLongitude, double obliquity) {
        return normalizeDegrees(greenwichMean(julianDate) + nutationInLongitude * Math.cos(Math.toRadians(obliquity)));
    }

    /**
     * @param longitude the observer longitude in degrees, positive east
     */
    public static double local(double greenwichSiderealTime, double longitude) {
        return normalizeDegrees(greenwichSiderealTime + longitude);
    }
}
