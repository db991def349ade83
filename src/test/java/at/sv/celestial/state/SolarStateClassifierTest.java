package at.sv.celestial.state;

import at.sv.celestial.event.EventType;
import at.sv.celestial.solver.CrossingPattern;
import at.sv.celestial.solver.HorizonCrossing;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static at.sv.celestial.event.EventType.RISE;
import static at.sv.celestial.event.EventType.SET;
import static org.assertj.core.api.Assertions.assertThat;

class SolarStateClassifierTest {

    private static CrossingPattern pattern(boolean aboveAtStart, EventType... types) {
        List<HorizonCrossing> crossings = new ArrayList<>();
        for (int i = 0; i < types.length; i++) {
            crossings.add(new HorizonCrossing(types[i], 1000L * (i + 1)));
        }
        return new CrossingPattern(crossings, aboveAtStart);
    }

    @Test
    void noCrossings_dependsOnSideAtStart() {
        assertThat(SolarStateClassifier.classify(pattern(true))).isEqualTo(HorizonCrossingSolarState.POLAR_DAY);
        assertThat(SolarStateClassifier.classify(pattern(false))).isEqualTo(HorizonCrossingSolarState.POLAR_NIGHT);
    }

    @Test
    void startsWithRise_risenAndSet() {
        assertThat(SolarStateClassifier.classify(pattern(false, RISE, SET))).isEqualTo(HorizonCrossingSolarState.RISEN_AND_SET);
        assertThat(SolarStateClassifier.classify(pattern(false, RISE))).isEqualTo(HorizonCrossingSolarState.RISEN_AND_SET);
    }

    @Test
    void startsWithSet_setAndRisen_evenWithoutRise() {
        assertThat(SolarStateClassifier.classify(pattern(true, SET, RISE))).isEqualTo(HorizonCrossingSolarState.SET_AND_RISEN);
        assertThat(SolarStateClassifier.classify(pattern(true, SET))).isEqualTo(HorizonCrossingSolarState.SET_AND_RISEN);
    }
}
