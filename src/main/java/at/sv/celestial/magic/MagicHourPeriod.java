package at.sv.celestial.magic;

import at.sv.celestial.time.Time;

import java.util.List;

/**
 * The magic hour intervals of one day. Together with {@code daylight} (Sun above the band) and {@code darkness}
 * (Sun below the band) they always cover exactly 24 hours.
 */
public record MagicHourPeriod(List<EventTrack> events, Time daylight, Time darkness) {

    public MagicHourPeriod {
        events = List.copyOf(events);
    }
}
