package at.sv.celestial;

import at.sv.celestial.api.CelestialEventsCalculator;
import at.sv.celestial.api.LunarEventsCalculatorImpl;
import at.sv.celestial.api.SolarEventsCalculatorImpl;
import at.sv.celestial.position.Twilight;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Locale;

@Command(name = "celestial-events", version = "1.0.0", mixinStandardHelpOptions = true, sortOptions = false,
        description = "Prints rise and set times, day lengths, magic hour and the lunar phase for a location as JSON.")
public final class CelestialEvents implements Runnable {

    private static final Logger LOG = LoggerFactory.getLogger(CelestialEvents.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Option(names = "--lat", required = true,
            defaultValue = "${env:LAT}",
            description = "The latitude of the location in degrees [-90..90].")
    double latitude;
    @Option(names = "--long", required = true,
            defaultValue = "${env:LONG}",
            description = "The longitude of the location in degrees [-180..180].")
    double longitude;
    @Option(names = "--date-time", paramLabel = "<dateTime>",
            description = "The ISO-8601 zoned date time to calculate the events for, e.g. 2025-03-20T12:00+01:00[Europe/Vienna]." +
                          " Default: now")
    ZonedDateTime dateTime;
    @Option(names = "--zone", paramLabel = "<zoneId>",
            defaultValue = "${env:ZONE}",
            description = "The time zone the results are expressed in. Default: the zone of --date-time, " +
                          "or the system default")
    ZoneId zone;
    @Option(names = "--body",
            defaultValue = "sun",
            description = "The celestial body: 'sun' or 'moon'. Default: ${DEFAULT-VALUE}")
    String body;
    @Option(names = "--mode",
            defaultValue = "day",
            description = "'day' for the civil day of the date time, 'upcoming' for the first day with an event after it, " +
                          "'next' for only the next event (sun), 'magic-hour' for the magic hour intervals (sun)." +
                          " Default: ${DEFAULT-VALUE}")
    String mode;
    @Option(names = "--twilight",
            defaultValue = "VISUAL",
            description = "The Sun altitude used in 'day' mode: ${COMPLETION-CANDIDATES}. Default: ${DEFAULT-VALUE}")
    Twilight twilight;

    private final CelestialEventsCalculator calculator;
    private final JsonOutput jsonOutput;

    public CelestialEvents() {
        this(create(), new JsonOutput());
    }

    CelestialEvents(CelestialEventsCalculator calculator, JsonOutput jsonOutput) {
        this.calculator = calculator;
        this.jsonOutput = jsonOutput;
    }

    /**
     * @return a calculator for both the Sun and the Moon
     */
    public static CelestialEventsCalculator create() {
        return new CelestialEventsCalculator(new SolarEventsCalculatorImpl(), new LunarEventsCalculatorImpl());
    }

    public static void main(String[] args) {
        int execute = new CommandLine(new CelestialEvents()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        if (execute != 0) {
            System.exit(execute);
        }
    }

    @Override
    public void run() {
        String normalizedBody = body.toLowerCase(Locale.ROOT);
        MDC.put("context", normalizedBody);
        ZonedDateTime queryTime = getQueryTime();
        LOG.debug("Calculating '{}' for {} at [{},{}] and {}", mode, normalizedBody, latitude, longitude, queryTime);
        Object result;
        try {
            result = switch (normalizedBody) {
                case "sun" -> calculateSolar(queryTime);
                case "moon" -> calculateLunar(queryTime);
                default -> throw fail("Unknown --body '" + body + "'. Supported: sun, moon");
            };
        } catch (InvalidArgument e) {
            throw fail(e.getMessage());
        }
        PrintWriter out = spec != null ? spec.commandLine().getOut() : new PrintWriter(System.out, true);
        out.println(jsonOutput.write(result));
        out.flush();
    }

    private ZonedDateTime getQueryTime() {
        if (dateTime == null) {
            return ZonedDateTime.now(zone != null ? zone : ZoneId.systemDefault());
        }
        if (zone != null) {
            return dateTime.withZoneSameInstant(zone);
        }
        return dateTime;
    }

    private Object calculateSolar(ZonedDateTime queryTime) {
        return switch (mode) {
            case "day" -> calculator.solar().calculateSolarAbsoluteEventDay(latitude, longitude, queryTime, twilight);
            case "upcoming" -> calculator.solar().findUpcomingSolarAbsoluteEventDay(latitude, longitude, queryTime);
            case "next" -> calculator.solar().findUpcomingSolarRelativeShortEventDay(latitude, longitude, queryTime);
            case "magic-hour" -> calculator.solar().calculateMagicHourPeriod(latitude, longitude, queryTime);
            default -> throw fail("Unknown --mode '" + mode + "'. Supported: day, upcoming, next, magic-hour");
        };
    }

    private Object calculateLunar(ZonedDateTime queryTime) {
        return switch (mode) {
            case "day" -> calculator.lunar().calculateLunarAbsoluteEventDay(latitude, longitude, queryTime);
            case "upcoming" -> calculator.lunar().findUpcomingLunarAbsoluteEventDay(latitude, longitude, queryTime);
            default -> throw fail("Unsupported --mode '" + mode + "' for the moon. Supported: day, upcoming");
        };
    }

    private RuntimeException fail(String msg) {
        if (spec != null) {
            return new CommandLine.ParameterException(spec.commandLine(), msg);
        }
        return new InvalidArgument(msg);
    }
}
