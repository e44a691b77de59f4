package com.punchclock.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;

public record BalanceResponse(
        Long uid,
        LocalDate firstDay,
        LocalDate lastDay,
        String zone,
        long windowStart,
        long windowEnd,
        long workedSeconds,
        long expectedSeconds,
        long openSessionSeconds,
        long delta
) {
}
