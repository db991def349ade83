package at.sv.celestial.api;

import at.sv.celestial.Coordinate;
import at.sv.celestial.event.EventType;
import at.sv.celestial.event.UpcomingAbsoluteEvent;
import at.sv.celestial.event.UpcomingRelativeEvent;
import at.sv.celestial.position.Angles;
import at.sv.celestial.position.CelestialBody;
import at.sv.celestial.solver.CrossingPattern;
import at.sv.celestial.solver.HorizonCrossing;
import at.sv.celestial.solver.HorizonCrossingSolver;
import at.sv.celestial.time.Time;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * Computes the crossings, lengths and transits of one body for civil days and searches forward for upcoming events.
 * Shared by the solar and the lunar calculator.
 */
@Slf4j
@RequiredArgsConstructor
final class EventDayEngine {

    static final int MAX_SEARCH_DAYS = 365;

    private final CelestialBody body;
    private final HorizonCrossingSolver solver;
    /**
     * How long past the end of a day the body is still sampled, so that crossings close to midnight are bracketed.
     */
    private final long scanPaddingMillis;

    DaySummary computeDay(Coordinate coordinate, LocalDate date, ZoneId zone) {
        ZonedDateTime dayStart = date.atStartOfDay(zone);
        ZonedDateTime dayEnd = date.plusDays(1).atStartOfDay(zone);
        long start = toMillis(dayStart);
        long end = toMillis(dayEnd);
        CrossingPattern today = findCrossings(coordinate, start, end);
        CrossingPattern previousDay = findCrossings(coordinate, toMillis(date.minusDays(1).atStartOfDay(zone)), start);
        long above = getAboveMillis(today, start, end);
        DaySummary summary = new DaySummary(dayStart, dayEnd, today, previousDay, above, end - start - above,
                findTransit(coordinate, start, end, 0.0), findTransit(coordinate, start, end, 180.0));
        log.debug("{} on {} at {}: crossings={}, aboveAtStart={}", body.getClass().getSimpleName(), date, coordinate,
                today.sequence(), today.aboveAtStart());
        return summary;
    }

    /**
     * Searches day by day, starting with the day of the query, for the first day with an event at or after the query
     * instant. If there is none within {@link #MAX_SEARCH_DAYS}, the query day is returned without remaining events.
     */
    UpcomingDay findUpcomingDay(Coordinate coordinate, ZonedDateTime dateTime) {
        long query = toMillis(dateTime);
        LocalDate queryDate = dateTime.toLocalDate();
        ZoneId zone = dateTime.getZone();
        DaySummary queryDay = null;
        for (int dayOffset = 0; dayOffset <= MAX_SEARCH_DAYS; dayOffset++) {
            DaySummary day = computeDay(coordinate, queryDate.plusDays(dayOffset), zone);
            if (queryDay == null) {
                queryDay = day;
            }
            List<HorizonCrossing> remaining = day.crossingsFrom(query);
            if (!remaining.isEmpty()) {
                if (dayOffset > 0) {
                    log.debug("Found upcoming {} after skipping {} day(s)", remaining.get(0).type(), dayOffset);
                }
                return new UpcomingDay(day, remaining);
            }
        }
        log.warn("No {} rise or set found within {} days after {} at {}", body.getClass().getSimpleName(),
                MAX_SEARCH_DAYS, dateTime, coordinate);
        return new UpcomingDay(queryDay, List.of());
    }

    List<UpcomingAbsoluteEvent> toAbsoluteEvents(Coordinate coordinate, List<HorizonCrossing> crossings, ZoneId zone) {
        return crossings.stream()
                        .map(crossing -> new UpcomingAbsoluteEvent(crossing.type(),
                                toDateTime(crossing.epochMillis(), zone),
                                getAzimuth(coordinate, crossing.epochMillis())))
                        .toList();
    }

    List<UpcomingRelativeEvent> toRelativeEvents(Coordinate coordinate, List<HorizonCrossing> crossings,
                                                 ZonedDateTime dateTime) {
        long query = toMillis(dateTime);
        return crossings.stream()
                        .map(crossing -> toRelativeEvent(coordinate, crossing, query, dateTime.getZone()))
                        .toList();
    }

    private UpcomingRelativeEvent toRelativeEvent(Coordinate coordinate, HorizonCrossing crossing, long query,
                                                  ZoneId zone) {
        long epochMillis = crossing.epochMillis();
        return new UpcomingRelativeEvent(crossing.type(), Time.of(toDateTime(epochMillis, zone).toLocalTime()),
                epochMillis - query, getAzimuth(coordinate, epochMillis));
    }

    double getAzimuth(Coordinate coordinate, long epochMillis) {
        return body.horizontal(coordinate, epochMillis).azimuth();
    }

    static @Nullable Time toClockTime(@Nullable Long epochMillis, ZoneId zone) {
        if (epochMillis == null) {
            return null;
        }
        return Time.of(toDateTime(epochMillis, zone).toLocalTime());
    }

    static long toMillis(ZonedDateTime dateTime) {
        return dateTime.toInstant().toEpochMilli();
    }

    private static ZonedDateTime toDateTime(long epochMillis, ZoneId zone) {
        return Instant.ofEpochMilli(epochMillis).atZone(zone);
    }

    private CrossingPattern findCrossings(Coordinate coordinate, long start, long end) {
        return solver.findCrossings(time -> body.altitudeAboveThreshold(coordinate, time), start, end,
                end + scanPaddingMillis);
    }

    /**
     * @param offset 0 for the upper transit, 180 for the lower one
     */
    private @Nullable Long findTransit(Coordinate coordinate, long start, long end, double offset) {
        List<Long> transits = solver.findAscendingZeros(
                time -> Angles.normalizeSignedDegrees(body.horizontal(coordinate, time).hourAngle() + offset),
                start, end);
        if (transits.isEmpty()) {
            return null;
        }
        return transits.get(0);
    }

    private static long getAboveMillis(CrossingPattern pattern, long start, long end) {
        boolean above = pattern.aboveAtStart();
        long segmentStart = start;
        long total = 0;
        for (HorizonCrossing crossing : pattern.crossings()) {
            if (above) {
                total += crossing.epochMillis() - segmentStart;
            }
            segmentStart = crossing.epochMillis();
            above = crossing.type() == EventType.RISE;
        }
        if (above) {
            total += end - segmentStart;
        }
        return total;
    }
}
