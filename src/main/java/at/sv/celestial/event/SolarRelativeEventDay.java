package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;
import at.sv.celestial.state.HorizonCrossingSolarState;
import at.sv.celestial.time.Time;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Sunrise and sunset of one civil day relative to the query instant.
 */
public record SolarRelativeEventDay(List<UpcomingRelativeEvent> events,
                                    HorizonCrossingSolarState type,
                                    HorizonCrossingSolarState preType,
                                    Time dayLength,
                                    Time nightLength,
                                    @Nullable Time meridianCrossing,
                                    @Nullable Time antimeridianCrossing) {

    public SolarRelativeEventDay {
        if (events == null || type == null || preType == null) {
            throw new InvalidArgument("Events, type and previous type are required");
        }
        events = EventValidator.assertSorted(events, UpcomingRelativeEvent::timeToNearestEventMillis);
        EventValidator.assertNonNegative(dayLength, "Day length");
        EventValidator.assertNonNegative(nightLength, "Night length");
    }
}
