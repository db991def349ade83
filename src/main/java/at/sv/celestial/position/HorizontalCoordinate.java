package at.sv.celestial.position;

/**
 * Position of a body in the sky of an observer.
 *
 * @param altitude  degrees above the horizon, negative below
 * @param azimuth   compass bearing in degrees [0, 360), 0 = north, measured clockwise
 * @param hourAngle local hour angle in degrees [-180, 180), 0 = upper meridian transit
 */
public record HorizontalCoordinate(double altitude, double azimuth, double hourAngle) {
}
