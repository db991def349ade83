package at.sv.celestial.api;

/**
 * Single entry point bundling the solar and the lunar calculator.
 */
public record CelestialEventsCalculator(SolarEventsCalculator solar, LunarEventsCalculator lunar) {
}
