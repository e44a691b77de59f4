package com.punchclock.backend.global.common.time;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Conversions between the Unix-second columns and java.time values.
 */
public final class UnixTime {

    private UnixTime() {
    }

    public static long now(Clock clock) {
        return clock.instant().getEpochSecond();
    }

    public static long startOfDay(LocalDate date, ZoneId zone) {
        return date.atStartOfDay(zone).toEpochSecond();
    }

    public static LocalDate localDate(long unixSeconds, ZoneId zone) {
        return Instant.ofEpochSecond(unixSeconds).atZone(zone).toLocalDate();
    }
}
