package at.sv.celestial.phase;

/**
 * @param ageInDays           days since the last new moon, within [0, synodic month)
 * @param illuminationPercent illuminated fraction of the lunar disk in percent, within [0,100]
 */
public record LunarPhase(double ageInDays, double illuminationPercent) {
}
