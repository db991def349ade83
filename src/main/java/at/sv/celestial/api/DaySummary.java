package at.sv.celestial.api;

import at.sv.celestial.solver.CrossingPattern;
import at.sv.celestial.solver.HorizonCrossing;
import org.jetbrains.annotations.Nullable;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Everything computed for a body on one civil day, before it is turned into a published result.
 *
 * @param previousDay crossings of the day before, used for the previous day's state
 */
record DaySummary(ZonedDateTime dayStart,
                  ZonedDateTime dayEnd,
                  CrossingPattern today,
                  CrossingPattern previousDay,
                  long aboveMillis,
                  long belowMillis,
                  @Nullable Long meridianCrossing,
                  @Nullable Long antimeridianCrossing) {

    List<HorizonCrossing> crossingsFrom(long epochMillis) {
        return today.crossings().stream()
                    .filter(crossing -> crossing.epochMillis() >= epochMillis)
                    .toList();
    }
}
