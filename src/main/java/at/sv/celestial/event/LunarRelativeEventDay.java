package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;
import at.sv.celestial.state.HorizonCrossingLunarState;
import at.sv.celestial.time.Time;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public record LunarRelativeEventDay(List<UpcomingRelativeEvent> events,
                                    HorizonCrossingLunarState type,
                                    HorizonCrossingLunarState preType,
                                    Time visibleLength,
                                    Time invisibleLength,
                                    @Nullable Time meridianCrossing,
                                    @Nullable Time antimeridianCrossing,
                                    double ageInDays,
                                    double illuminationPercent) {

    public LunarRelativeEventDay {
        if (events == null || type == null || preType == null) {
            throw new InvalidArgument("Events, type and previous type are required");
        }
        events = EventValidator.assertSorted(events, UpcomingRelativeEvent::timeToNearestEventMillis);
        EventValidator.assertNonNegative(visibleLength, "Visible length");
        EventValidator.assertNonNegative(invisibleLength, "Invisible length");
        EventValidator.assertValidAge(ageInDays);
        EventValidator.assertValidIllumination(illuminationPercent);
    }
}
