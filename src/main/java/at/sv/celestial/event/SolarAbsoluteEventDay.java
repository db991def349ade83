package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;
import at.sv.celestial.state.HorizonCrossingSolarState;
import at.sv.celestial.time.Time;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Sunrise and sunset of one civil day as absolute instants.
 *
 * @param preType              state of the previous civil day
 * @param meridianCrossing     clock time of the upper transit, {@code null} if there is none that day
 * @param antimeridianCrossing clock time of the lower transit, {@code null} if there is none that day
 */
public record SolarAbsoluteEventDay(List<UpcomingAbsoluteEvent> events,
                                    HorizonCrossingSolarState type,
                                    HorizonCrossingSolarState preType,
                                    Time dayLength,
                                    Time nightLength,
                                    @Nullable Time meridianCrossing,
                                    @Nullable Time antimeridianCrossing) {

    public SolarAbsoluteEventDay {
        if (events == null || type == null || preType == null) {
            throw new InvalidArgument("Events, type and previous type are required");
        }
        events = EventValidator.assertSorted(events, UpcomingAbsoluteEvent::epochMillis);
        EventValidator.assertNonNegative(dayLength, "Day length");
        EventValidator.assertNonNegative(nightLength, "Night length");
    }
}
