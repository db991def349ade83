package at.sv.celestial.solver;

import at.sv.celestial.event.EventType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the zero crossings of a {@link Signal} by sampling it at a fixed step, bisecting every bracket with a sign
 * change until it is narrower than one second and finishing with a linear interpolation inside the last bracket.
 * <p>
 * Crossings that touch the threshold between two samples without changing sides are not detected, which only
 * matters for grazing passes close to polar day or night.
 */
@Slf4j
public final class HorizonCrossingSolver {

    public static final long DEFAULT_STEP_MILLIS = 10 * 60 * 1000L;
    private static final long TOLERANCE_MILLIS = 1000L;
    /**
     * A refined bracket whose ends still differ by more than this is a wrap-around of an angular signal.
     */
    private static final double DISCONTINUITY = 90.0;

    private final long stepMillis;

    public HorizonCrossingSolver() {
        this(DEFAULT_STEP_MILLIS);
    }

    public HorizonCrossingSolver(long stepMillis) {
        if (stepMillis <= TOLERANCE_MILLIS) {
            throw new IllegalArgumentException("Sampling step must be larger than " + TOLERANCE_MILLIS + "ms: " + stepMillis);
        }
        this.stepMillis = stepMillis;
    }

    /**
     * Same as {@link #findCrossings(Signal, long, long, long)} without sampling past the end of the window.
     */
    public CrossingPattern findCrossings(Signal signal, long start, long end) {
        return findCrossings(signal, start, end, end);
    }

    /**
     * @param start   inclusive start of the window in epoch millis
     * @param end     exclusive end of the window in epoch millis
     * @param scanEnd the last sampled instant, at or after {@code end}. Only crossings within {@code [start, end)} are
     *                reported.
     * @return all crossings within the window, in chronological order
     */
    public CrossingPattern findCrossings(Signal signal, long start, long end, long scanEnd) {
        if (end < start || scanEnd < end) {
            throw new IllegalArgumentException("Invalid search window: start=" + start + ", end=" + end + ", scanEnd=" + scanEnd);
        }
        List<HorizonCrossing> crossings = new ArrayList<>();
        double startValue = signal.valueAt(start);
        boolean aboveAtStart = isAbove(startValue);
        long previousTime = start;
        double previousValue = startValue;
        if (startValue == 0.0 && start < scanEnd) {
            long next = Math.min(start + stepMillis, scanEnd);
            double nextValue = signal.valueAt(next);
            boolean rising = isAbove(nextValue);
            aboveAtStart = rising;
            if (start < end) {
                // the side before a crossing at the very start is the opposite one
                aboveAtStart = !rising;
                crossings.add(new HorizonCrossing(rising ? EventType.RISE : EventType.SET, start));
            }
            previousTime = next;
            previousValue = nextValue;
        }

        while (previousTime < scanEnd) {
            long time = Math.min(previousTime + stepMillis, scanEnd);
            double value = signal.valueAt(time);
            if (isAbove(previousValue) != isAbove(value)) {
                refine(signal, previousTime, previousValue, time, value, start, end, crossings);
            }
            previousTime = time;
            previousValue = value;
        }
        return new CrossingPattern(crossings, aboveAtStart);
    }

    /**
     * @return the instants within {@code [start, end)} at which the signal ascends through zero, ignoring
     * wrap-arounds of angular signals
     */
    public List<Long> findAscendingZeros(Signal signal, long start, long end) {
        return findCrossings(signal, start, end).crossings().stream()
                                                .filter(crossing -> crossing.type() == EventType.RISE)
                                                .map(HorizonCrossing::epochMillis)
                                                .toList();
    }

    private void refine(Signal signal, long low, double lowValue, long high, double highValue, long start, long end,
                        List<HorizonCrossing> crossings) {
        boolean lowAbove = isAbove(lowValue);
        while (high - low > TOLERANCE_MILLIS) {
            long middle = low + (high - low) / 2;
            double middleValue = signal.valueAt(middle);
            if (isAbove(middleValue) == lowAbove) {
                low = middle;
                lowValue = middleValue;
            } else {
                high = middle;
                highValue = middleValue;
            }
        }
        if (Math.abs(highValue - lowValue) > DISCONTINUITY) {
            log.trace("Ignoring discontinuity between {} and {}", low, high);
            return;
        }
        long crossing = interpolate(low, lowValue, high, highValue);
        if (crossing < start || crossing >= end) {
            return;
        }
        EventType type = lowAbove ? EventType.SET : EventType.RISE;
        log.trace("Found {} at {}", type, crossing);
        crossings.add(new HorizonCrossing(type, crossing));
    }

    private static long interpolate(long low, double lowValue, long high, double highValue) {
        if (lowValue == highValue) {
            return low;
        }
        double fraction = lowValue / (lowValue - highValue);
        long offset = (long) Math.floor(fraction * (high - low));
        return Math.max(low, Math.min(high, low + offset));
    }

    private static boolean isAbove(double value) {
        return value > 0;
    }
}
