package com.punchclock.backend.modules.attendance.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record EditEntryRequest(
        @NotNull(message = "from is required")
        @PositiveOrZero(message = "from must be a Unix timestamp")
        Long from,
        @NotNull(message = "to is required")
        @PositiveOrZero(message = "to must be a Unix timestamp")
        Long to
) {
}
