package at.sv.celestial.position;

/**
 * The Moon. Its threshold depends on the current distance: the horizontal parallax lifts the geocentric rise/set
 * altitude by almost a degree, while refraction (34') lowers it.
 */
public final class Moon implements CelestialBody {

    private static final double PARALLAX_FACTOR = 0.7275;
    private static final double STANDARD_REFRACTION = 34.0 / 60.0;

    @Override
    public EquatorialCoordinate equatorial(double julianDate) {
        return LunarPosition.compute(julianDate);
    }

    @Override
    public double thresholdAltitude(EquatorialCoordinate position) {
        return PARALLAX_FACTOR * LunarPosition.horizontalParallax(position.distanceKm()) - STANDARD_REFRACTION;
    }
}
