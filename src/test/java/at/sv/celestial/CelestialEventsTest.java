package at.sv.celestial;

import at.sv.celestial.api.CelestialEventsCalculator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

class CelestialEventsTest {

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    private int execute(String... args) {
        return commandLine.execute(args);
    }

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CelestialEvents()).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @Test
    void create_providesBothCalculators() {
        CelestialEventsCalculator calculator = CelestialEvents.create();

        assertThat(calculator.solar()).isNotNull();
        assertThat(calculator.lunar()).isNotNull();
    }

    @Test
    void solarDay_printsJson() {
        int exitCode = execute("--lat", "48.2", "--long", "16.39",
                "--date-time", "2025-03-20T12:00:00+01:00[Europe/Vienna]");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"type\" : \"RISEN_AND_SET\"")
                                  .contains("\"dayLength\"")
                                  .contains("+01:00");
    }

    @Test
    void civilTwilight_caseInsensitive() {
        int exitCode = execute("--lat", "48.2", "--long", "16.39", "--twilight", "civil",
                "--date-time", "2025-03-20T12:00:00Z");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"RISE\"").contains("\"SET\"");
    }

    @Test
    void zone_convertsQueryTime() {
        int exitCode = execute("--lat", "0", "--long", "0", "--mode", "upcoming", "--zone", "Asia/Tokyo",
                "--date-time", "2025-03-20T12:00:00Z");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("+09:00");
    }

    @Test
    void nextEvent() {
        int exitCode = execute("--lat", "0", "--long", "0", "--mode", "next", "--date-time", "2025-06-01T05:00:00Z");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"eventType\" : \"RISE\"").contains("\"timestampMillis\"");
    }

    @Test
    void magicHour() {
        int exitCode = execute("--lat", "52.52", "--long", "13.40", "--mode", "magic-hour",
                "--date-time", "2024-07-01T12:00:00+02:00[Europe/Berlin]");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("MAGIC_HOUR").contains("\"daylight\"").contains("\"darkness\"");
    }

    @Test
    void moon_upcoming() {
        int exitCode = execute("--lat", "52.52", "--long", "13.40", "--body", "moon", "--mode", "upcoming",
                "--date-time", "2024-01-25T12:00:00+01:00[Europe/Berlin]");

        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("\"illuminationPercent\"").contains("\"ageInDays\"");
    }

    @Test
    void invalidLatitude_nonZeroExit_withMessage() {
        int exitCode = execute("--lat", "-91", "--long", "0", "--date-time", "2025-03-20T12:00:00Z");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("Latitude must be between -90 and 90");
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void unsupportedModeForMoon_nonZeroExit() {
        int exitCode = execute("--lat", "0", "--long", "0", "--body", "moon", "--mode", "magic-hour",
                "--date-time", "2025-03-20T12:00:00Z");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("Unsupported --mode 'magic-hour' for the moon");
    }

    @Test
    void unknownBody_nonZeroExit() {
        int exitCode = execute("--lat", "0", "--long", "0", "--body", "mars");

        assertThat(exitCode).isNotZero();
        assertThat(err.toString()).contains("Unknown --body 'mars'");
    }
}
