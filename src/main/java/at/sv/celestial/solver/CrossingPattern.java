package at.sv.celestial.solver;

import at.sv.celestial.event.EventType;

import java.util.List;

/**
 * The crossings found within one search window in chronological order, together with the side of the threshold the
 * signal was on at the start of the window.
 */
public record CrossingPattern(List<HorizonCrossing> crossings, boolean aboveAtStart) {

    public CrossingPattern {
        crossings = List.copyOf(crossings);
    }

    /**
     * @return the side at the end of the window, derived from the last crossing
     */
    public boolean aboveAtEnd() {
        if (crossings.isEmpty()) {
            return aboveAtStart;
        }
        return crossings.get(crossings.size() - 1).type() == EventType.RISE;
    }

    public List<EventType> sequence() {
        return crossings.stream().map(HorizonCrossing::type).toList();
    }

    public boolean isEmpty() {
        return crossings.isEmpty();
    }
}
