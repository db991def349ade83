package at.sv.celestial.state;

import at.sv.celestial.event.EventType;
import at.sv.celestial.solver.CrossingPattern;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;

import static at.sv.celestial.event.EventType.RISE;
import static at.sv.celestial.event.EventType.SET;

/**
 * Labels the crossings of the Moon within one day by looking up the complete rise/set sequence. The side of the
 * horizon at the start of the day, i.e. where the previous day ended, has to agree with the first event.
 */
@Slf4j
public final class LunarStateClassifier {
    private LunarStateClassifier() {
    }

    private static final Map<List<EventType>, HorizonCrossingLunarState> BY_SEQUENCE = Map.of(
            List.of(SET), HorizonCrossingLunarState.ONLY_SET,
            List.of(RISE), HorizonCrossingLunarState.ONLY_RISEN,
            List.of(RISE, SET), HorizonCrossingLunarState.RISEN_AND_SET,
            List.of(SET, RISE), HorizonCrossingLunarState.SET_AND_RISEN,
            List.of(SET, RISE, SET), HorizonCrossingLunarState.SET_RISE_SET
    );

    public static HorizonCrossingLunarState classify(CrossingPattern pattern) {
        if (pattern.isEmpty()) {
            return pattern.aboveAtStart() ? HorizonCrossingLunarState.FULL_DAY : HorizonCrossingLunarState.FULL_NIGHT;
        }
        List<EventType> sequence = pattern.sequence();
        boolean startsWithSet = sequence.get(0) == SET;
        if (startsWithSet != pattern.aboveAtStart()) {
            log.debug("First event {} contradicts the previous day ending {} the horizon", sequence.get(0),
                    pattern.aboveAtStart() ? "above" : "below");
            return HorizonCrossingLunarState.ERROR;
        }
        HorizonCrossingLunarState state = BY_SEQUENCE.get(sequence);
        if (state == null) {
            log.debug("Unclassifiable lunar crossing sequence {}", sequence);
            return HorizonCrossingLunarState.ERROR;
        }
        return state;
    }
}
