package com.punchclock.backend.modules.attendance.presentation;

import java.time.LocalDate;
import java.time.ZoneId;

import com.punchclock.backend.modules.attendance.application.AttendanceZones;
import com.punchclock.backend.modules.attendance.application.BalanceService;
import com.punchclock.backend.modules.attendance.application.EntryQueryService;
import com.punchclock.backend.modules.attendance.presentation.dto.AttendanceDtoMapper;
import com.punchclock.backend.modules.attendance.presentation.dto.BalanceResponse;
import com.punchclock.backend.modules.attendance.presentation.dto.EntryDaysResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{uid}")
public class EntryController {

    private final EntryQueryService entryQueryService;
    private final BalanceService balanceService;
    private final AttendanceZones zones;

    public EntryController(EntryQueryService entryQueryService, BalanceService balanceService, AttendanceZones zones) {
        this.entryQueryService = entryQueryService;
        this.balanceService = balanceService;
        this.zones = zones;
    }

    @Operation(summary = "Entries grouped by the local day each session started")
    @GetMapping("/entries")
    public ResponseEntity<EntryDaysResponse> listEntries(
            @PathVariable("uid") Long uid,
            @RequestParam(name = "zone", required = false) String zone
    ) {
        ZoneId resolved = zones.resolve(AttendanceZones.parse(zone));
        return ResponseEntity.ok(AttendanceDtoMapper.toEntryDaysResponse(
                entryQueryService.listEntries(uid, resolved), resolved));
    }

    @Operation(summary = "Balance for one local day")
    @GetMapping("/balance/day")
    public ResponseEntity<BalanceResponse> getDayBalance(
            @PathVariable("uid") Long uid,
            @RequestParam(name = "date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "zone", required = false) String zone
    ) {
        return ResponseEntity.ok(AttendanceDtoMapper.toBalanceResponse(
                balanceService.getDayReport(uid, date, AttendanceZones.parse(zone))));
    }

    @Operation(summary = "Month-to-date balance", description = "From the first of the month through the given date.")
    @GetMapping("/balance/month")
    public ResponseEntity<BalanceResponse> getMonthBalance(
            @PathVariable("uid") Long uid,
            @RequestParam(name = "date") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(name = "zone", required = false) String zone
    ) {
        return ResponseEntity.ok(AttendanceDtoMapper.toBalanceResponse(
                balanceService.getMonthReport(uid, date, AttendanceZones.parse(zone))));
    }
}
