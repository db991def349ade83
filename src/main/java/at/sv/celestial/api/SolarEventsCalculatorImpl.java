package at.sv.celestial.api;

import at.sv.celestial.Coordinate;
import at.sv.celestial.event.SolarAbsoluteEventDay;
import at.sv.celestial.event.SolarRelativeEventDay;
import at.sv.celestial.event.UpcomingShortEvent;
import at.sv.celestial.magic.MagicHourPeriod;
import at.sv.celestial.magic.MagicHourSegmenter;
import at.sv.celestial.position.CelestialBody;
import at.sv.celestial.position.Sun;
import at.sv.celestial.position.Twilight;
import at.sv.celestial.solver.HorizonCrossing;
import at.sv.celestial.solver.HorizonCrossingSolver;
import at.sv.celestial.state.HorizonCrossingSolarState;
import at.sv.celestial.state.SolarStateClassifier;
import at.sv.celestial.time.Time;
import lombok.extern.slf4j.Slf4j;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

@Slf4j
public final class SolarEventsCalculatorImpl implements SolarEventsCalculator {

    private final Map<Twilight, EventDayEngine> engines = new EnumMap<>(Twilight.class);
    private final MagicHourSegmenter magicHourSegmenter;

    public SolarEventsCalculatorImpl() {
        this(Sun::new, new HorizonCrossingSolver());
    }

    /**
     * @param sunFactory creates the Sun for the different threshold altitudes
     */
    public SolarEventsCalculatorImpl(Function<Twilight, CelestialBody> sunFactory, HorizonCrossingSolver solver) {
        for (Twilight twilight : Twilight.values()) {
            engines.put(twilight, new EventDayEngine(sunFactory.apply(twilight), solver, 0));
        }
        magicHourSegmenter = new MagicHourSegmenter(sunFactory.apply(Twilight.VISUAL), solver);
    }

    @Override
    public SolarRelativeEventDay calculateSolarEventDay(double latitude, double longitude, ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        EventDayEngine engine = engines.get(Twilight.VISUAL);
        DaySummary day = engine.computeDay(coordinate, dateTime.toLocalDate(), dateTime.getZone());
        return createRelativeDay(engine, coordinate, day, day.today().crossings(), dateTime);
    }

    @Override
    public SolarAbsoluteEventDay calculateSolarAbsoluteEventDay(double latitude, double longitude,
                                                                ZonedDateTime dateTime) {
        return calculateSolarAbsoluteEventDay(latitude, longitude, dateTime, Twilight.VISUAL);
    }

    @Override
    public SolarAbsoluteEventDay calculateSolarAbsoluteEventDay(double latitude, double longitude,
                                                                ZonedDateTime dateTime, Twilight twilight) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        EventDayEngine engine = engines.get(twilight);
        DaySummary day = engine.computeDay(coordinate, dateTime.toLocalDate(), dateTime.getZone());
        return createAbsoluteDay(engine, coordinate, day, day.today().crossings(), dateTime);
    }

    @Override
    public SolarAbsoluteEventDay findUpcomingSolarAbsoluteEventDay(double latitude, double longitude,
                                                                   ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        EventDayEngine engine = engines.get(Twilight.VISUAL);
        UpcomingDay upcoming = engine.findUpcomingDay(coordinate, dateTime);
        return createAbsoluteDay(engine, coordinate, upcoming.day(), upcoming.remaining(), dateTime);
    }

    @Override
    public SolarRelativeEventDay findUpcomingSolarRelativeEventDay(double latitude, double longitude,
                                                                   ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        EventDayEngine engine = engines.get(Twilight.VISUAL);
        UpcomingDay upcoming = engine.findUpcomingDay(coordinate, dateTime);
        return createRelativeDay(engine, coordinate, upcoming.day(), upcoming.remaining(), dateTime);
    }

    @Override
    public @Nullable UpcomingShortEvent findUpcomingSolarRelativeShortEventDay(double latitude, double longitude,
                                                                               ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        EventDayEngine engine = engines.get(Twilight.VISUAL);
        UpcomingDay upcoming = engine.findUpcomingDay(coordinate, dateTime);
        if (upcoming.isExhausted()) {
            return null;
        }
        HorizonCrossing next = upcoming.remaining().get(0);
        return new UpcomingShortEvent(next.type(), next.epochMillis() - EventDayEngine.toMillis(dateTime),
                engine.getAzimuth(coordinate, next.epochMillis()));
    }

    @Override
    public MagicHourPeriod calculateMagicHourPeriod(double latitude, double longitude, ZonedDateTime dateTime) {
        Coordinate coordinate = Coordinate.of(latitude, longitude);
        return magicHourSegmenter.segment(coordinate, dateTime.toLocalDate().atStartOfDay(dateTime.getZone()));
    }

    private SolarAbsoluteEventDay createAbsoluteDay(EventDayEngine engine, Coordinate coordinate, DaySummary day,
                                                    List<HorizonCrossing> crossings, ZonedDateTime dateTime) {
        return new SolarAbsoluteEventDay(engine.toAbsoluteEvents(coordinate, crossings, dateTime.getZone()),
                getType(day), getPreType(day),
                Time.fromTotalMilliseconds(day.aboveMillis()),
                Time.fromTotalMilliseconds(day.belowMillis()),
                EventDayEngine.toClockTime(day.meridianCrossing(), dateTime.getZone()),
                EventDayEngine.toClockTime(day.antimeridianCrossing(), dateTime.getZone()));
    }

    private SolarRelativeEventDay createRelativeDay(EventDayEngine engine, Coordinate coordinate, DaySummary day,
                                                    List<HorizonCrossing> crossings, ZonedDateTime dateTime) {
        return new SolarRelativeEventDay(engine.toRelativeEvents(coordinate, crossings, dateTime),
                getType(day), getPreType(day),
                Time.fromTotalMilliseconds(day.aboveMillis()),
                Time.fromTotalMilliseconds(day.belowMillis()),
                EventDayEngine.toClockTime(day.meridianCrossing(), dateTime.getZone()),
                EventDayEngine.toClockTime(day.antimeridianCrossing(), dateTime.getZone()));
    }

    private static HorizonCrossingSolarState getType(DaySummary day) {
        HorizonCrossingSolarState state = SolarStateClassifier.classify(day.today());
        log.debug("Solar state on {}: {}", day.dayStart().toLocalDate(), state);
        return state;
    }

    private static HorizonCrossingSolarState getPreType(DaySummary day) {
        return SolarStateClassifier.classify(day.previousDay());
    }
}
