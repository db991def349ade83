package at.sv.celestial.event;

import at.sv.celestial.InvalidArgument;
import at.sv.celestial.state.HorizonCrossingLunarState;
import at.sv.celestial.time.Time;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Moonrises and moonsets of one civil day as absolute instants, together with the phase of the Moon at the query
 * instant.
 *
 * @param visibleLength       time the Moon spends above the horizon within the day
 * @param ageInDays           days since the last new moon, within [0, synodic month)
 * @param illuminationPercent illuminated fraction of the disk in percent
 */
public record LunarAbsoluteEventDay(List<UpcomingAbsoluteEvent> events,
                                    HorizonCrossingLunarState type,
                                    HorizonCrossingLunarState preType,
                                    Time visibleLength,
                                    Time invisibleLength,
                                    @Nullable Time meridianCrossing,
                                    @Nullable Time antimeridianCrossing,
                                    double ageInDays,
                                    double illuminationPercent) {

    public LunarAbsoluteEventDay {
        if (events == null || type == null || preType == null) {
            throw new InvalidArgument("Events, type and previous type are required");
        }
        events = EventValidator.assertSorted(events, UpcomingAbsoluteEvent::epochMillis);
        EventValidator.assertNonNegative(visibleLength, "Visible length");
        EventValidator.assertNonNegative(invisibleLength, "Invisible length");
        EventValidator.assertValidAge(ageInDays);
        EventValidator.assertValidIllumination(illuminationPercent);
    }
}
