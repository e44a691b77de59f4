package com.punchclock.backend.modules.attendance.presentation.dto;

public record SweepResponse(
        long ranAt,
        int scanned,
        int disqualified,
        int failed,
        int flipped
) {
}
