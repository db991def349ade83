package at.sv.celestial.position;

import at.sv.celestial.time.JulianDate;
import at.sv.celestial.time.SiderealTime;

import static at.sv.celestial.position.Angles.cosDeg;
import static at.sv.celestial.position.Angles.normalizeDegrees;
import static at.sv.celestial.position.Angles.sinDeg;

/**
 * Apparent geocentric position of the Moon from a truncated version of the ELP-2000/82 series as tabulated in Meeus
 * chapter 47. Only the leading periodic terms are kept, which gives roughly 0.01° in longitude, 0.005° in latitude
 * and 20 km in distance. More than enough for rise and set times within a minute.
 */
public final class LunarPosition {
    private LunarPosition() {
    }

    public static final double EARTH_EQUATORIAL_RADIUS_KM = 6378.14;
    private static final double MEAN_DISTANCE_KM = 385000.56;

    /**
     * Multiples of D, M, M', F followed by the coefficients for longitude (1e-6 degrees) and distance (1e-3 km).
     */
    private static final int[][] LONGITUDE_DISTANCE_TERMS = {
            {0, 0, 1, 0, 6288774, -20905355},
            {2, 0, -1, 0, 1274027, -3699111},
            {2, 0, 0, 0, 658314, -2955968},
            {0, 0, 2, 0, 213618, -569925},
            {0, 1, 0, 0, -185116, 48888},
            {0, 0, 0, 2, -114332, -3149},
            {2, 0, -2, 0, 58793, 246158},
            {2, -1, -1, 0, 57066, -152138},
            {2, 0, 1, 0, 53322, -170733},
            {2, -1, 0, 0, 45758, -204586},
            {0, 1, -1, 0, -40923, -129620},
            {1, 0, 0, 0, -34720, 108743},
            {0, 1, 1, 0, -30383, 104755},
            {2, 0, 0, -2, 15327, 10321},
            {0, 0, 1, 2, -12528, 0},
            {0, 0, 1, -2, 10980, 79661},
            {4, 0, -1, 0, 10675, -34782},
            {0, 0, 3, 0, 10034, -23210},
            {4, 0, -2, 0, 8548, -21636},
            {2, 1, -1, 0, -7888, 24208},
            {2, 1, 0, 0, -6766, 30824},
            {1, 0, -1, 0, -5163, -8379},
            {1, 1, 0, 0, 4987, -16675},
            {2, -1, 1, 0, 4036, -12831},
            {2, 0, 2, 0, 3994, -10445},
            {4, 0, 0, 0, 3861, -11650},
            {2, 0, -3, 0, 3665, 14403},
            {0, 1, -2, 0, -2689, -7003},
    };

    /**
     * Multiples of D, M, M', F followed by the coefficient for latitude (1e-6 degrees).
     */
    private static final int[][] LATITUDE_TERMS = {
            {0, 0, 0, 1, 5128122},
            {0, 0, 1, 1, 280602},
            {0, 0, 1, -1, 277693},
            {2, 0, 0, -1, 173237},
            {2, 0, -1, 1, 55413},
            {2, 0, -1, -1, 46271},
            {2, 0, 0, 1, 32573},
            {0, 0, 2, 1, 17198},
            {2, 0, 1, -1, 9266},
            {0, 0, 2, -1, 8822},
            {2, -1, 0, -1, 8216},
            {2, 0, -2, -1, 4324},
            {2, 0, 1, 1, 4200},
    };

    /**
     * @param julianDate Julian Date of Universal Time
     */
    public static EquatorialCoordinate compute(double julianDate) {
        double t = JulianDate.julianCenturies(JulianDate.toTerrestrial(julianDate));
        double t2 = t * t;
        double t3 = t2 * t;
        double t4 = t3 * t;

        double meanLongitude = normalizeDegrees(218.3164477 + 481267.88123421 * t - 0.0015786 * t2
                                                + t3 / 538841.0 - t4 / 65194000.0);
        double elongation = normalizeDegrees(297.8501921 + 445267.1114034 * t - 0.0018819 * t2
                                             + t3 / 545868.0 - t4 / 113065000.0);
        double sunAnomaly = normalizeDegrees(357.5291092 + 35999.0502909 * t - 0.0001536 * t2 + t3 / 24490000.0);
        double moonAnomaly = normalizeDegrees(134.9633964 + 477198.8675055 * t + 0.0087414 * t2
                                              + t3 / 69699.0 - t4 / 14712000.0);
        double argumentOfLatitude = normalizeDegrees(93.2720950 + 483202.0175233 * t - 0.0036539 * t2
                                                     - t3 / 3526000.0 + t4 / 863310000.0);
        double eccentricity = 1 - 0.002516 * t - 0.0000074 * t2;

        double a1 = 119.75 + 131.849 * t;
        double a2 = 53.09 + 479264.290 * t;
        double a3 = 313.45 + 481266.484 * t;

        double sumLongitude = 0;
        double sumDistance = 0;
        for (int[] term : LONGITUDE_DISTANCE_TERMS) {
            double argument = term[0] * elongation + term[1] * sunAnomaly + term[2] * moonAnomaly
                              + term[3] * argumentOfLatitude;
            double factor = eccentricityFactor(term[1], eccentricity);
            sumLongitude += term[4] * factor * sinDeg(argument);
            sumDistance += term[5] * factor * cosDeg(argument);
        }
        sumLongitude += 3958 * sinDeg(a1) + 1962 * sinDeg(meanLongitude - argumentOfLatitude) + 318 * sinDeg(a2);

        double sumLatitude = 0;
        for (int[] term : LATITUDE_TERMS) {
            double argument = term[0] * elongation + term[1] * sunAnomaly + term[2] * moonAnomaly
                              + term[3] * argumentOfLatitude;
            sumLatitude += term[4] * eccentricityFactor(term[1], eccentricity) * sinDeg(argument);
        }
        sumLatitude += -2235 * sinDeg(meanLongitude) + 382 * sinDeg(a3)
                       + 175 * sinDeg(a1 - argumentOfLatitude) + 175 * sinDeg(a1 + argumentOfLatitude)
                       + 127 * sinDeg(meanLongitude - moonAnomaly) - 115 * sinDeg(meanLongitude + moonAnomaly);

        Nutation nutation = Nutation.of(t);
        double longitude = meanLongitude + sumLongitude / 1_000_000.0 + nutation.longitude();
        double latitude = sumLatitude / 1_000_000.0;
        double distanceKm = MEAN_DISTANCE_KM + sumDistance / 1000.0;

        double gst = SiderealTime.greenwichApparent(julianDate, nutation.longitude(), nutation.obliquity());
        return EquatorialCoordinate.fromEcliptic(longitude, latitude, distanceKm, nutation.obliquity(), gst);
    }

    /**
     * @return the equatorial horizontal parallax in degrees for the given distance
     */
    public static double horizontalParallax(double distanceKm) {
        return Math.toDegrees(Math.asin(EARTH_EQUATORIAL_RADIUS_KM / distanceKm));
    }

    private static double eccentricityFactor(int sunAnomalyMultiple, double eccentricity) {
        return switch (Math.abs(sunAnomalyMultiple)) {
            case 1 -> eccentricity;
            case 2 -> eccentricity * eccentricity;
            default -> 1.0;
        };
    }
}
