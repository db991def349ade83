package at.sv.celestial.api;

import at.sv.celestial.Coordinate;
import at.sv.celestial.event.LunarAbsoluteEventDay;
import at.sv.celestial.event.LunarRelativeEventDay;
import at.sv.celestial.phase.LunarPhase;
import at.sv.celestial.phase.LunarPhaseCalculator;
import at.sv.celestial.position.CelestialBody;
import at.sv.celestial.position.Moon;
import at.sv.celestial.solver.HorizonCrossing;
import at.sv.celestial.solver.HorizonCrossingSolver;
import at.sv.celestial.state.HorizonCrossingLunarState;
import at.sv.celestial.state.LunarStateClassifier;
import at.sv.celestial.time.Time;
import lombok.extern.slf4j.Slf4j;

import java.time.ZonedDateTime;
import java.util.List;

@Slf4j
public final class LunarEventsCalculatorImpl implements LunarEventsCalculator {

    /**
     * The Moon rises about 50 minutes later every day, so it is sampled a bit past the end of the civil day.
     */
    static final long SCAN_PADDING_MILLIS = Time.MILLIS_PER_HOUR;

    private final EventDayEngine engine;
    private final LunarPhaseCalculator phaseCalculator;

    public LunarEventsCalculatorImpl() {
        this(new Moon(), new HorizonCrossingSolver(), new LunarPhaseCalculator());
    }

    public LunarEventsCalculatorImpl(CelestialBody moon, HorizonCrossingSolver solver,
                                     LunarPhaseCalculator phaseCalculator) {
        this.engine = new EventDayEngine(moon, solver, SCAN_PADDING_MILLIS);
        this.phaseCalculator = phaseCalculator;
    }

    @Override
    public LunarRelativeEventDay calculateLunarEventDay(double latitude, double longitude, ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        DaySummary day = engine.computeDay(coordinate, dateTime.toLocalDate(), dateTime.getZone());
        return createRelativeDay(coordinate, day, day.today().crossings(), dateTime);
    }

    @Override
    public LunarAbsoluteEventDay calculateLunarAbsoluteEventDay(double latitude, double longitude,
                                                                ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        DaySummary day = engine.computeDay(coordinate, dateTime.toLocalDate(), dateTime.getZone());
        return createAbsoluteDay(coordinate, day, day.today().crossings(), dateTime);
    }

    @Override
    public LunarRelativeEventDay findUpcomingLunarRelativeEventDay(double latitude, double longitude,
                                                                   ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        UpcomingDay upcoming = engine.findUpcomingDay(coordinate, dateTime);
        return createRelativeDay(coordinate, upcoming.day(), upcoming.remaining(), dateTime);
    }

    @Override
    public LunarAbsoluteEventDay findUpcomingLunarAbsoluteEventDay(double latitude, double longitude,
                                                                   ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        UpcomingDay upcoming = engine.findUpcomingDay(coordinate, dateTime);
        return createAbsoluteDay(coordinate, upcoming.day(), upcoming.remaining(), dateTime);
    }

    private LunarAbsoluteEventDay createAbsoluteDay(Coordinate coordinate, DaySummary day,
                                                    List<HorizonCrossing> crossings, ZonedDateTime dateTime) {
        LunarPhase phase = phaseCalculator.calculate(EventDayEngine.toMillis(dateTime));
        return new LunarAbsoluteEventDay(engine.toAbsoluteEvents(coordinate, crossings, dateTime.getZone()),
                getType(day), getPreType(day),
                Time.fromTotalMilliseconds(day.aboveMillis()),
                Time.fromTotalMilliseconds(day.belowMillis()),
                EventDayEngine.toClockTime(day.meridianCrossing(), dateTime.getZone()),
                EventDayEngine.toClockTime(day.antimeridianCrossing(), dateTime.getZone()),
                phase.ageInDays(), phase.illuminationPercent());
    }

    private LunarRelativeEventDay createRelativeDay(Coordinate coordinate, DaySummary day,
                                                    List<HorizonCrossing> crossings, ZonedDateTime dateTime) {
        LunarPhase phase = phaseCalculator.calculate(EventDayEngine.toMillis(dateTime));
        return new LunarRelativeEventDay(engine.toRelativeEvents(coordinate, crossings, dateTime),
                getType(day), getPreType(day),
                Time.fromTotalMilliseconds(day.aboveMillis()),
                Time.fromTotalMilliseconds(day.belowMillis()),
                EventDayEngine.toClockTime(day.meridianCrossing(), dateTime.getZone()),
                EventDayEngine.toClockTime(day.antimeridianCrossing(), dateTime.getZone()),
                phase.ageInDays(), phase.illuminationPercent());
    }

    private static HorizonCrossingLunarState getType(DaySummary day) {
        HorizonCrossingLunarState state = LunarStateClassifier.classify(day.today());
        log.debug("Lunar state on {}: {}", day.dayStart().toLocalDate(), state);
        return state;
    }

    private static HorizonCrossingLunarState getPreType(DaySummary day) {
        return LunarStateClassifier.classify(day.previousDay());
    }
}
