package com.punchclock.backend.modules.attendance.presentation.dto;

public record StatusResponse(
        Long uid,
        String state,
        long since,
        long asOf,
        long openSessionSeconds,
        long dayDelta,
        long monthDelta
) {
}
