package com.punchclock.backend.modules.attendance.presentation.dto;

public record ClockStatusResponse(
        Long uid,
        String state,
        long since
) {
}
