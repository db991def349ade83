package at.sv.celestial.state;

public enum HorizonCrossingSolarState {
    /**
     * The first event of the day is a sunrise.
     */
    RISEN_AND_SET,
    /**
     * The first event of the day is a sunset, i.e. the Sun was up at the start of the day.
     */
    SET_AND_RISEN,
    POLAR_DAY,
    POLAR_NIGHT
}
