package at.sv.celestial.solver;

import at.sv.celestial.event.EventType;

/**
 * A single zero crossing of a {@link Signal}: {@link EventType#RISE} when ascending, {@link EventType#SET} when
 * descending.
 */
public record HorizonCrossing(EventType type, long epochMillis) {
}
