package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;

import java.time.ZonedDateTime;

/**
 * A rise or set at an absolute instant, expressed in the zone of the query.
 *
 * @param azimuth degrees clockwise from north, within [0,360)
 */
public record UpcomingAbsoluteEvent(EventType type, ZonedDateTime dateTime, double azimuth) {

    public UpcomingAbsoluteEvent {
        if (type == null || dateTime == null) {
            throw new InvalidArgument("Event type and date time are required");
        }
        EventValidator.assertValidAzimuth(azimuth);
    }

    public long epochMillis() {
        return dateTime.toInstant().toEpochMilli();
    }
}
