package at.sv.celestial.position;

public final class Angles {
    private Angles() {
    }

    /**
     * @return the angle reduced to [0, 360)
     */
    public static double normalizeDegrees(double degrees) {
        double result = degrees % 360.0;
        if (result < 0) {
            result += 360.0;
        }
        return result >= 360.0 ? 0.0 : result;
    }

    /**
     * @return the angle reduced to [-180, 180)
     */
    public static double normalizeSignedDegrees(double degrees) {
        return normalizeDegrees(degrees + 180.0) - 180.0;
    }

    static double sinDeg(double degrees) {
        return Math.sin(Math.toRadians(degrees));
    }

    static double cosDeg(double degrees) {
        return Math.cos(Math.toRadians(degrees));
    }
}
