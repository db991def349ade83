package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;

/**
 * The next single event after the query instant.
 *
 * @param timestampMillis milliseconds from the query instant until the event, zero if both coincide
 */
public record UpcomingShortEvent(EventType eventType, long timestampMillis, double azimuth) {

    public UpcomingShortEvent {
        if (eventType == null) {
            throw new InvalidArgument("Event type is required");
        }
        if (timestampMillis < 0) {
            throw new InvalidArgument("Upcoming event can't be in the past: " + timestampMillis + "ms");
        }
        EventValidator.assertValidAzimuth(azimuth);
    }
}
