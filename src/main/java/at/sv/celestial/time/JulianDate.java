package at.sv.celestial.time;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Conversions between calendar instants and the Julian Date (JD), the continuous day count used by all position
 * algorithms. The calendar algorithm follows Jean Meeus, "Astronomical Algorithms", 2nd edition, chapter 7.
 */
public final class JulianDate {
    private JulianDate() {
    }

    public static final double J2000 = 2451545.0;
    public static final double UNIX_EPOCH = 2440587.5;
    public static final double DAYS_PER_CENTURY = 36525.0;

    private static final double SECONDS_PER_DAY = 86400.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    /**
     * Converts the given instant to the Julian Date of Universal Time. {@code java.time} dates are proleptic Gregorian,
     * so the Gregorian correction term is applied for every date.
     */
    public static double of(ZonedDateTime dateTime) {
        ZonedDateTime utc = dateTime.withZoneSameInstant(ZoneOffset.UTC);
        int year = utc.getYear();
        int month = utc.getMonthValue();
        double day = utc.getDayOfMonth() + utc.toLocalTime().toNanoOfDay() / (SECONDS_PER_DAY * 1e9);
        if (month <= 2) {
            year -= 1;
            month += 12;
        }
        int a = Math.floorDiv(year, 100);
        int b = 2 - a + Math.floorDiv(a, 4);
        return Math.floor(365.25 * (year + 4716)) + Math.floor(30.6001 * (month + 1)) + day + b - 1524.5;
    }

    public static double ofEpochMillis(long epochMillis) {
        return epochMillis / MILLIS_PER_DAY + UNIX_EPOCH;
    }

    public static long toEpochMillis(double julianDate) {
        return Math.round((julianDate - UNIX_EPOCH) * MILLIS_PER_DAY);
    }

    public static Instant toInstant(double julianDate) {
        return Instant.ofEpochMilli(toEpochMillis(julianDate));
    }

    /**
     * @return the Julian Ephemeris Day (Terrestrial Time) for the given Julian Date of Universal Time
     */
    public static double toTerrestrial(double julianDate) {
        return julianDate + DeltaT.seconds(decimalYear(julianDate)) / SECONDS_PER_DAY;
    }

    /**
     * @return Julian centuries since J2000.0 for the given Julian (Ephemeris) Date
     */
    public static double julianCenturies(double julianDate) {
        return (julianDate - J2000) / DAYS_PER_CENTURY;
    }

    static double decimalYear(double julianDate) {
        return 2000.0 + (julianDate - J2000) / 365.25;
    }
}
