package com.punchclock.backend.modules.attendance.domain;

import java.time.DayOfWeek;
import java.time.LocalDate;

/**
 * Expected working time: a fixed amount per weekday, nothing on Saturday or Sunday.
 * Holidays are not considered.
 */
public class ExpectedHoursPolicy {

    public static final long STANDARD_WEEKDAY_SECONDS = 8L * 60 * 60;

    private final long secondsPerWeekday;

    public ExpectedHoursPolicy(long secondsPerWeekday) {
        if (secondsPerWeekday < 0) {
            throw new IllegalArgumentException("secondsPerWeekday must be >= 0");
        }
        this.secondsPerWeekday = secondsPerWeekday;
    }

    public static ExpectedHoursPolicy standard() {
        return new ExpectedHoursPolicy(STANDARD_WEEKDAY_SECONDS);
    }

    public boolean isWorkday(LocalDate date) {
        DayOfWeek dayOfWeek = date.getDayOfWeek();
        return dayOfWeek != DayOfWeek.SATURDAY && dayOfWeek != DayOfWeek.SUNDAY;
    }

    public long expectedSeconds(WorkWindow window) {
        return window.days().filter(this::isWorkday).count() * secondsPerWeekday;
    }
}
