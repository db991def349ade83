package at.sv.celestial.time;

/**
 * Approximates ΔT = TT − UT, the drift of Earth's rotation against uniform time, with the polynomial expressions of
 * Espenak and Meeus (NASA Five Millennium Canon of Solar Eclipses). Outside of the fitted range -500..2150 the long term
 * parabola is used, so the result degrades gracefully instead of failing.
 */
public final class DeltaT {
    private DeltaT() {
    }

    /**
     * @param year the decimal year, e.g. 2025.5 for the beginning of July 2025
     * @return ΔT in seconds
     */
    public static double seconds(double year) {
        if (year < -500) {
            return longTermParabola(year);
        }
        if (year < 500) {
            double u = year / 100;
            return 10583.6 - 1014.41 * u + 33.78311 * u * u - 5.952053 * Math.pow(u, 3)
                   - 0.1798452 * Math.pow(u, 4) + 0.022174192 * Math.pow(u, 5) + 0.0090316521 * Math.pow(u, 6);
        }
        if (year < 1600) {
            double u = (year - 1000) / 100;
            return 1574.2 - 556.01 * u + 71.23472 * u * u + 0.319781 * Math.pow(u, 3)
                   - 0.8503463 * Math.pow(u, 4) - 0.005050998 * Math.pow(u, 5) + 0.0083572073 * Math.pow(u, 6);
        }
        if (year < 1700) {
            double t = year - 1600;
            return 120 - 0.9808 * t - 0.01532 * t * t + Math.pow(t, 3) / 7129;
        }
        if (year < 1800) {
            double t = year - 1700;
            return 8.83 + 0.1603 * t - 0.0059285 * t * t + 0.00013336 * Math.pow(t, 3) - Math.pow(t, 4) / 1174000;
        }
        if (year < 1860) {
            double t = year - 1800;
            return 13.72 - 0.332447 * t + 0.0068612 * t * t + 0.0041116 * Math.pow(t, 3) - 0.00037436 * Math.pow(t, 4)
                   + 0.0000121272 * Math.pow(t, 5) - 0.0000001699 * Math.pow(t, 6) + 0.000000000875 * Math.pow(t, 7);
        }
        if (year < 1900) {
            double t = year - 1860;
            return 7.62 + 0.5737 * t - 0.251754 * t * t + 0.01680668 * Math.pow(t, 3)
                   - 0.0004473624 * Math.pow(t, 4) + Math.pow(t, 5) / 233174;
        }
        if (year < 1920) {
            double t = year - 1900;
            return -2.79 + 1.494119 * t - 0.0598939 * t * t + 0.0061966 * Math.pow(t, 3) - 0.000197 * Math.pow(t, 4);
        }
        if (year < 1941) {
            double t = year - 1920;
            return 21.20 + 0.84493 * t - 0.076100 * t * t + 0.0020936 * Math.pow(t, 3);
        }
        if (year < 1961) {
            double t = year - 1950;
            return 29.07 + 0.407 * t - t * t / 233 + Math.pow(t, 3) / 2547;
        }
        if (year < 1986) {
            double t = year - 1975;
            return 45.45 + 1.067 * t - t * t / 260 - Math.pow(t, 3) / 718;
        }
        if (year < 2005) {
            double t = year - 2000;
            return 63.86 + 0.3345 * t - 0.060374 * t * t + 0.0017275 * Math.pow(t, 3)
                   + 0.000651814 * Math.pow(t, 4) + 0.00002373599 * Math.pow(t, 5);
        }
        if (year < 2050) {
            double t = year - 2000;
            return 62.92 + 0.32217 * t + 0.005589 * t * t;
        }
        if (year < 2150) {
            return longTermParabola(year) - 0.5628 * (2150 - year);
        }
        return longTermParabola(year);
    }

    private static double longTermParabola(double year) {
        double u = (year - 1820) / 100;
        return -20 + 32 * u * u;
    }
}
