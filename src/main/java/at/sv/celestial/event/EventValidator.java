package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;
import at.sv.celestial.time.Time;

import java.util.List;
import java.util.function.ToLongFunction;

import static at.sv.celestial.phase.LunarPhaseCalculator.SYNODIC_MONTH_DAYS;

/**
 * Invariant checks shared by the event and event day records.
 */
final class EventValidator {
    private EventValidator() {
    }

    static double assertValidAzimuth(double azimuth) {
        if (Double.isNaN(azimuth) || azimuth < 0 || azimuth >= 360) {
            throw new InvalidArgument("Azimuth must be within [0,360). Provided value: " + azimuth);
        }
        return azimuth;
    }

    static <T> List<T> assertSorted(List<T> events, ToLongFunction<T> timeOf) {
        for (int i = 1; i < events.size(); i++) {
            if (timeOf.applyAsLong(events.get(i - 1)) > timeOf.applyAsLong(events.get(i))) {
                throw new InvalidArgument("Events must be sorted ascending by time: " + events);
            }
        }
        return List.copyOf(events);
    }

    static Time assertNonNegative(Time length, String name) {
        if (length == null) {
            throw new InvalidArgument(name + " is required");
        }
        if (length.toTotalMilliseconds() < 0) {
            throw new InvalidArgument(name + " must not be negative. Provided value: " + length);
        }
        return length;
    }

    static double assertValidIllumination(double illuminationPercent) {
        if (Double.isNaN(illuminationPercent) || illuminationPercent < 0 || illuminationPercent > 100) {
            throw new InvalidArgument("Illumination must be between 0 and 100 percent. Provided value: " + illuminationPercent);
        }
        return illuminationPercent;
    }

    static double assertValidAge(double ageInDays) {
        if (Double.isNaN(ageInDays) || ageInDays < 0 || ageInDays >= SYNODIC_MONTH_DAYS) {
            throw new InvalidArgument("Age must be within [0," + SYNODIC_MONTH_DAYS + ") days. Provided value: " + ageInDays);
        }
        return ageInDays;
    }
}
