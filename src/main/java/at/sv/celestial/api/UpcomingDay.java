package at.sv.celestial.api;

import at.sv.celestial.solver.HorizonCrossing;

import java.util.List;

/**
 * The first day with an event at or after the query instant, together with those remaining events.
 */
record UpcomingDay(DaySummary day, List<HorizonCrossing> remaining) {

    boolean isExhausted() {
        return remaining.isEmpty();
    }
}
