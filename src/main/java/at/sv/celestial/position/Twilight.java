package at.sv.celestial.position;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Named altitudes of the Sun's center that mark the start and end of the different phases of the day.
 */
@Getter
@RequiredArgsConstructor
public enum Twilight {
    /**
     * Upper limb touches the horizon, including standard refraction and the solar semi-diameter.
     */
    VISUAL(-0.8333),
    CIVIL(-6.0),
    NAUTICAL(-12.0),
    ASTRONOMICAL(-18.0),
    /**
     * Upper bound of the magic hour band.
     */
    GOLDEN_HOUR(6.0),
    /**
     * Lower bound of the magic hour band.
     */
    BLUE_HOUR(-4.0);

    private final double altitude;
}
