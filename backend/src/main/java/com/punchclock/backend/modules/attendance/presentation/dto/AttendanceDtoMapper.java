package com.punchclock.backend.modules.attendance.presentation.dto;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import com.punchclock.backend.modules.attendance.application.BalanceService.BalanceReport;
import com.punchclock.backend.modules.attendance.application.BalanceService.StatusSummary;
import com.punchclock.backend.modules.attendance.application.DisqualificationService.SweepResult;
import com.punchclock.backend.modules.attendance.domain.ClockStatus;
import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.domain.WorkWindow;

public final class AttendanceDtoMapper {

    private AttendanceDtoMapper() {
    }

    public static ClockStatusResponse toClockStatusResponse(ClockStatus status) {
        return new ClockStatusResponse(status.uid(), status.state().name(), status.since());
    }

    public static StatusResponse toStatusResponse(StatusSummary summary) {
        ClockStatus status = summary.status();
        return new StatusResponse(
                status.uid(),
                status.state().name(),
                status.since(),
                summary.asOf(),
                status.openSessionSeconds(summary.asOf()),
                summary.day().delta(),
                summary.month().delta()
        );
    }

    public static EntryResponse toEntryResponse(WorkEntry entry) {
        return new EntryResponse(entry.getEid(), entry.getFromSeconds(), entry.getToSeconds(), entry.isValid());
    }

    public static EntryDaysResponse toEntryDaysResponse(SortedMap<LocalDate, List<WorkEntry>> days, ZoneId zone) {
        Map<String, List<EntryResponse>> byDay = new LinkedHashMap<>();
        days.forEach((day, entries) -> byDay.put(
                day.toString(),
                entries.stream().map(AttendanceDtoMapper::toEntryResponse).toList()
        ));
        return new EntryDaysResponse(zone.getId(), byDay);
    }

    public static BalanceResponse toBalanceResponse(BalanceReport report) {
        WorkWindow window = report.window();
        return new BalanceResponse(
                report.uid(),
                window.firstDay(),
                window.lastDay(),
                window.zone().getId(),
                window.start(),
                window.end(),
                report.workedSeconds(),
                report.expectedSeconds(),
                report.openSessionSeconds(),
                report.delta()
        );
    }

    public static SweepResponse toSweepResponse(SweepResult result) {
        return new SweepResponse(
                result.ranAt(),
                result.scanned(),
                result.disqualified(),
                result.failed(),
                result.flipped()
        );
    }
}
