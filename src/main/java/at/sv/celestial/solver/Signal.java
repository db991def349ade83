package at.sv.celestial.solver;

/**
 * A continuous function of time whose zero crossings are searched for, e.g. the altitude of a body above its
 * rise/set threshold.
 */
@FunctionalInterface
public interface Signal {
    double valueAt(long epochMillis);
}
