package at.sv.celestial.magic;

import at.sv.celestial.Coordinate;
import at.sv.celestial.event.EventType;
import at.sv.celestial.position.CelestialBody;
import at.sv.celestial.position.Twilight;
import at.sv.celestial.solver.CrossingPattern;
import at.sv.celestial.solver.HorizonCrossing;
import at.sv.celestial.solver.HorizonCrossingSolver;
import at.sv.celestial.time.Time;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a day at the crossings of the Sun's geometric altitude through the {@link Twilight#BLUE_HOUR} and
 * {@link Twilight#GOLDEN_HOUR} altitudes and emits the parts within the band as magic hour intervals.
 */
@Slf4j
@RequiredArgsConstructor
public final class MagicHourSegmenter {

    private static final long DAY_MILLIS = Time.MILLIS_PER_DAY;

    private final CelestialBody sun;
    private final HorizonCrossingSolver solver;

    /**
     * @param dayStart the start of the day; the segmented range ends exactly 24 hours later
     */
    public MagicHourPeriod segment(Coordinate coordinate, ZonedDateTime dayStart) {
        long start = dayStart.toInstant().toEpochMilli();
        long end = start + DAY_MILLIS;
        double lower = Twilight.BLUE_HOUR.getAltitude();
        double upper = Twilight.GOLDEN_HOUR.getAltitude();
        CrossingPattern lowerCrossings = solver.findCrossings(time -> altitude(coordinate, time) - lower, start, end);
        CrossingPattern upperCrossings = solver.findCrossings(time -> altitude(coordinate, time) - upper, start, end);

        List<Boundary> boundaries = new ArrayList<>();
        lowerCrossings.crossings().forEach(crossing -> boundaries.add(new Boundary(crossing, false)));
        upperCrossings.crossings().forEach(crossing -> boundaries.add(new Boundary(crossing, true)));
        boundaries.sort(Comparator.comparingLong(boundary -> boundary.crossing().epochMillis()));

        Zone zone = Zone.of(lowerCrossings.aboveAtStart(), upperCrossings.aboveAtStart());
        long segmentStart = start;
        Double segmentStartAzimuth = null;
        long daylight = 0;
        long darkness = 0;
        List<EventTrack> tracks = new ArrayList<>();
        for (Boundary boundary : boundaries) {
            long time = boundary.crossing().epochMillis();
            double azimuth = sun.horizontal(coordinate, time).azimuth();
            switch (zone) {
                case ABOVE -> daylight += time - segmentStart;
                case BELOW -> darkness += time - segmentStart;
                case BAND -> addTrack(tracks, dayStart, segmentStart, segmentStartAzimuth, time, azimuth);
            }
            zone = zone.after(boundary);
            segmentStart = time;
            segmentStartAzimuth = azimuth;
        }
        switch (zone) {
            case ABOVE -> daylight += end - segmentStart;
            case BELOW -> darkness += end - segmentStart;
            case BAND -> addTrack(tracks, dayStart, segmentStart, segmentStartAzimuth, end, null);
        }
        log.debug("Magic hour for {} on {}: {} intervals, daylight={}ms, darkness={}ms", coordinate,
                dayStart.toLocalDate(), tracks.size(), daylight, darkness);
        return new MagicHourPeriod(tracks, Time.fromTotalMilliseconds(daylight), Time.fromTotalMilliseconds(darkness));
    }

    private double altitude(Coordinate coordinate, long epochMillis) {
        return sun.horizontal(coordinate, epochMillis).altitude();
    }

    private static void addTrack(List<EventTrack> tracks, ZonedDateTime dayStart, long start, Double startAzimuth,
                                 long finish, Double finishAzimuth) {
        if (finish <= start) {
            return;
        }
        tracks.add(new EventTrack(TypeEventTrack.MAGIC_HOUR,
                new TrackPoint(toDateTime(start, dayStart), startAzimuth),
                new TrackPoint(toDateTime(finish, dayStart), finishAzimuth)));
    }

    private static ZonedDateTime toDateTime(long epochMillis, ZonedDateTime dayStart) {
        return Instant.ofEpochMilli(epochMillis).atZone(dayStart.getZone());
    }

    private record Boundary(HorizonCrossing crossing, boolean upper) {
    }

    private enum Zone {
        BELOW, BAND, ABOVE;

        static Zone of(boolean aboveLower, boolean aboveUpper) {
            if (aboveUpper) {
                return ABOVE;
            }
            return aboveLower ? BAND : BELOW;
        }

        Zone after(Boundary boundary) {
            boolean rising = boundary.crossing().type() == EventType.RISE;
            if (boundary.upper()) {
                return rising ? ABOVE : BAND;
            }
            return rising ? BAND : BELOW;
        }
    }
}
