package at.sv.celestial.position;

import lombok.RequiredArgsConstructor;

/**
 * The Sun with a fixed threshold altitude, {@link Twilight#VISUAL} for sunrise and sunset or any of the other
 * twilight phases.
 */
@RequiredArgsConstructor
public final class Sun implements CelestialBody {

    private final Twilight twilight;

    public Sun() {
        this(Twilight.VISUAL);
    }

    @Override
    public EquatorialCoordinate equatorial(double julianDate) {
        return SolarPosition.compute(julianDate);
    }

    @Override
    public double thresholdAltitude(EquatorialCoordinate position) {
        return twilight.getAltitude();
    }
}
