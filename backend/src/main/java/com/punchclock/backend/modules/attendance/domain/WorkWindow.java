package com.punchclock.backend.modules.attendance.domain;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.stream.Stream;

import com.punchclock.backend.global.common.time.UnixTime;

/**
 * Half-open balance window {@code [start, end)} over whole local days {@code firstDay..lastDay}.
 */
public record WorkWindow(LocalDate firstDay, LocalDate lastDay, ZoneId zone, long start, long end) {

    public WorkWindow {
        Objects.requireNonNull(firstDay, "firstDay");
        Objects.requireNonNull(lastDay, "lastDay");
        Objects.requireNonNull(zone, "zone");
        if (lastDay.isBefore(firstDay)) {
            throw new IllegalArgumentException("lastDay must not precede firstDay");
        }
    }

    public static WorkWindow ofDays(LocalDate firstDay, LocalDate lastDay, ZoneId zone) {
        return new WorkWindow(
                firstDay,
                lastDay,
                zone,
                UnixTime.startOfDay(firstDay, zone),
                UnixTime.startOfDay(lastDay.plusDays(1), zone)
        );
    }

    public static WorkWindow day(LocalDate date, ZoneId zone) {
        return ofDays(date, date, zone);
    }

    /**
     * Month-to-date: from the first of the month up to the end of {@code date}, not the end of the month.
     */
    public static WorkWindow monthToDate(LocalDate date, ZoneId zone) {
        return ofDays(date.withDayOfMonth(1), date, zone);
    }

    /**
     * An entry counts only when it lies strictly inside the window at both ends.
     */
    public boolean strictlyContains(long from, long to) {
        return from > start && to < end;
    }

    public Stream<LocalDate> days() {
        return firstDay.datesUntil(lastDay.plusDays(1));
    }
}
