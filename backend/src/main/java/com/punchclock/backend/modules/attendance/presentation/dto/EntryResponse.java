package com.punchclock.backend.modules.attendance.presentation.dto;

public record EntryResponse(
        Long eid,
        long from,
        long to,
        boolean valid
) {
}
