package com.punchclock.backend.modules.attendance.presentation.dto;

import java.util.List;
import java.util.Map;

/**
 * Entries keyed by ISO local date ({@code yyyy-MM-dd}) of their start, in ascending day order.
 */
public record EntryDaysResponse(
        String zone,
        Map<String, List<EntryResponse>> days
) {
}
