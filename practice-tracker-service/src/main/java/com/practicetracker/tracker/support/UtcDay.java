package com.practicetracker.tracker.support;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * The UTC calendar day containing an instant, as the half-open range
 * {@code [start, end)}.
 */
@Getter
@AllArgsConstructor
public final class UtcDay {

    private final LocalDate date;
    private final Instant start;
    private final Instant end;

    public static UtcDay of(Instant instant) {
        LocalDate date = LocalDate.ofInstant(instant, ZoneOffset.UTC);
        return new UtcDay(date,
                date.atStartOfDay().toInstant(ZoneOffset.UTC),
                date.plusDays(1).atStartOfDay().toInstant(ZoneOffset.UTC));
    }
}
