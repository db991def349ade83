package at.sv.celestial.position;

import at.sv.celestial.time.JulianDate;
import at.sv.celestial.time.SiderealTime;

import static at.sv.celestial.position.Angles.cosDeg;
import static at.sv.celestial.position.Angles.normalizeDegrees;
import static at.sv.celestial.position.Angles.sinDeg;

/**
 * Apparent geocentric position of the Sun with the low accuracy method of Meeus chapter 25: mean longitude, mean
 * anomaly and equation of center, corrected for aberration and nutation. Good to about 0.01°, which keeps sunrise and
 * sunset within a few seconds of time.
 */
public final class SolarPosition {
    private SolarPosition() {
    }

    public static final double ASTRONOMICAL_UNIT_KM = 149_597_870.7;

    /**
     * @param julianDate Julian Date of Universal Time
     */
    public static EquatorialCoordinate compute(double julianDate) {
        double t = JulianDate.julianCenturies(JulianDate.toTerrestrial(julianDate));

        double meanLongitude = normalizeDegrees(280.46646 + 36000.76983 * t + 0.0003032 * t * t);
        double meanAnomaly = normalizeDegrees(357.52911 + 35999.05029 * t - 0.0001537 * t * t);
        double eccentricity = 0.016708634 - 0.000042037 * t - 0.0000001267 * t * t;
        double equationOfCenter = (1.914602 - 0.004817 * t - 0.000014 * t * t) * sinDeg(meanAnomaly)
                                  + (0.019993 - 0.000101 * t) * sinDeg(2 * meanAnomaly)
                                  + 0.000289 * sinDeg(3 * meanAnomaly);
        double trueLongitude = meanLongitude + equationOfCenter;
        double trueAnomaly = meanAnomaly + equationOfCenter;
        double radiusAu = 1.000001018 * (1 - eccentricity * eccentricity) / (1 + eccentricity * cosDeg(trueAnomaly));

        Nutation nutation = Nutation.of(t);
        double aberration = -20.4898 / 3600.0 / radiusAu;
        double apparentLongitude = trueLongitude + aberration + nutation.longitude();

        double gst = SiderealTime.greenwichApparent(julianDate, nutation.longitude(), nutation.obliquity());
        return EquatorialCoordinate.fromEcliptic(apparentLongitude, 0.0, radiusAu * ASTRONOMICAL_UNIT_KM,
                nutation.obliquity(), gst);
    }
}
