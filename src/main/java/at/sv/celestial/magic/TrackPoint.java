package at.sv.celestial.magic;

import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;

/**
 * A boundary of an {@link EventTrack}.
 *
 * @param azimuth the Sun's azimuth at a genuine threshold crossing, {@code null} if the boundary is the start or end
 *                of the day
 */
public record TrackPoint(ZonedDateTime dateTime, @Nullable Double azimuth) {
}
