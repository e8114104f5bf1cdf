package de.mirkosertic.filesearch.query;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Clock reading and zone used to resolve symbolic date expressions once per search.
 */
public record FilterContext(long nowEpochSeconds, ZoneId zone) {

    public static FilterContext of(final Clock clock) {
        return new FilterContext(clock.instant().getEpochSecond(), clock.getZone());
    }
}
