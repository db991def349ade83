package at.sv.celestial.magic;

import java.time.Duration;

public record EventTrack(TypeEventTrack typeEventTrack, TrackPoint start, TrackPoint finish) {

    public Duration duration() {
        return Duration.between(start.dateTime(), finish.dateTime());
    }
}
