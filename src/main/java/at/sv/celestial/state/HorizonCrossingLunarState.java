package at.sv.celestial.state;

/**
 * The pattern of moonrises and moonsets within one civil day. As the Moon rises about 50 minutes later every day, a
 * day may contain a single event or even three of them.
 */
public enum HorizonCrossingLunarState {
    SET_AND_RISEN,
    RISEN_AND_SET,
    SET_RISE_SET,
    FULL_DAY,
    FULL_NIGHT,
    ONLY_SET,
    ONLY_RISEN,
    /**
     * A crossing pattern that could not be classified.
     */
    ERROR
}
