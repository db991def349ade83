package at.sv.celestial.state;

import at.sv.celestial.event.EventType;
import at.sv.celestial.solver.CrossingPattern;

import java.util.EnumMap;
import java.util.Map;

/**
 * Labels the crossings of the Sun within one day. Only the first event matters: a day that starts with a sunset had
 * the Sun above the threshold at midnight, even if it never rises again.
 */
public final class SolarStateClassifier {
    private SolarStateClassifier() {
    }

    private static final Map<EventType, HorizonCrossingSolarState> BY_FIRST_EVENT = new EnumMap<>(EventType.class);

    static {
        BY_FIRST_EVENT.put(EventType.RISE, HorizonCrossingSolarState.RISEN_AND_SET);
        BY_FIRST_EVENT.put(EventType.SET, HorizonCrossingSolarState.SET_AND_RISEN);
    }

    public static HorizonCrossingSolarState classify(CrossingPattern pattern) {
        if (pattern.isEmpty()) {
            return pattern.aboveAtStart() ? HorizonCrossingSolarState.POLAR_DAY : HorizonCrossingSolarState.POLAR_NIGHT;
        }
        return BY_FIRST_EVENT.get(pattern.crossings().get(0).type());
    }
}
