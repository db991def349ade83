package at.sv.celestial.phase;

import at.sv.celestial.position.Angles;
import at.sv.celestial.position.EquatorialCoordinate;
import at.sv.celestial.position.LunarPosition;
import at.sv.celestial.position.SolarPosition;
import at.sv.celestial.time.JulianDate;

/**
 * Age and illumination of the Moon from the geocentric positions of Sun and Moon (Meeus chapter 48).
 */
public final class LunarPhaseCalculator {

    public static final double SYNODIC_MONTH_DAYS = 29.530588853;

    public LunarPhase calculate(long epochMillis) {
        double julianDate = JulianDate.ofEpochMillis(epochMillis);
        EquatorialCoordinate sun = SolarPosition.compute(julianDate);
        EquatorialCoordinate moon = LunarPosition.compute(julianDate);
        return new LunarPhase(getAgeInDays(sun, moon), getIlluminationPercent(sun, moon));
    }

    private static double getIlluminationPercent(EquatorialCoordinate sun, EquatorialCoordinate moon) {
        double elongation = Math.acos(clamp(
                Math.sin(Math.toRadians(sun.declination())) * Math.sin(Math.toRadians(moon.declination()))
                + Math.cos(Math.toRadians(sun.declination())) * Math.cos(Math.toRadians(moon.declination()))
                  * Math.cos(Math.toRadians(sun.rightAscension() - moon.rightAscension())), -1, 1));
        double phaseAngle = Math.atan2(sun.distanceKm() * Math.sin(elongation),
                moon.distanceKm() - sun.distanceKm() * Math.cos(elongation));
        double illuminatedFraction = (1 + Math.cos(phaseAngle)) / 2;
        return clamp(illuminatedFraction * 100, 0, 100);
    }

    private static double getAgeInDays(EquatorialCoordinate sun, EquatorialCoordinate moon) {
        double elongationInLongitude = Angles.normalizeDegrees(moon.eclipticLongitude() - sun.eclipticLongitude());
        double age = elongationInLongitude / 360.0 * SYNODIC_MONTH_DAYS;
        return Math.min(age, Math.nextDown(SYNODIC_MONTH_DAYS));
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
