package at.sv.celestial.position;

import static at.sv.celestial.position.Angles.cosDeg;
import static at.sv.celestial.position.Angles.sinDeg;

/**
 * Low precision nutation and obliquity of the ecliptic (Meeus chapter 22, accurate to about half an arc second
 * in longitude and a tenth in obliquity).
 *
 * @param longitude nutation in longitude Δψ, degrees
 * @param obliquity true obliquity of the ecliptic ε, degrees
 */
record Nutation(double longitude, double obliquity) {

    static Nutation of(double julianCenturies) {
        double t = julianCenturies;
        double omega = 125.04452 - 1934.136261 * t;
        double sunMeanLongitude = 280.4665 + 36000.7698 * t;
        double moonMeanLongitude = 218.3165 + 481267.8813 * t;

        double deltaPsi = (-17.20 * sinDeg(omega) - 1.32 * sinDeg(2 * sunMeanLongitude)
                           - 0.23 * sinDeg(2 * moonMeanLongitude) + 0.21 * sinDeg(2 * omega)) / 3600.0;
        double deltaEpsilon = (9.20 * cosDeg(omega) + 0.57 * cosDeg(2 * sunMeanLongitude)
                               + 0.10 * cosDeg(2 * moonMeanLongitude) - 0.09 * cosDeg(2 * omega)) / 3600.0;
        double meanObliquity = 23.0 + 26.0 / 60 + 21.448 / 3600
                               - (46.8150 * t + 0.00059 * t * t - 0.001813 * t * t * t) / 3600.0;
        return new Nutation(deltaPsi, meanObliquity + deltaEpsilon);
    }
}
