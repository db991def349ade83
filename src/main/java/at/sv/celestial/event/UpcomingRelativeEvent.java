package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;
import at.sv.celestial.time.Time;

/**
 * A rise or set relative to the query instant.
 *
 * @param time                     the clock time of the event in the zone of the query
 * @param timeToNearestEventMillis event minus query instant; negative for events that already happened
 * @param azimuth                  degrees clockwise from north, within [0,360)
 */
public record UpcomingRelativeEvent(EventType type, Time time, long timeToNearestEventMillis, double azimuth) {

    public UpcomingRelativeEvent {
        if (type == null || time == null) {
            throw new InvalidArgument("Event type and time are required");
        }
        EventValidator.assertValidAzimuth(azimuth);
    }
}
