package com.punchclock.backend.modules.attendance.presentation;

import com.punchclock.backend.modules.attendance.application.AttendanceZones;
import com.punchclock.backend.modules.attendance.application.BalanceService;
import com.punchclock.backend.modules.attendance.application.ClockService;
import com.punchclock.backend.modules.attendance.presentation.dto.AttendanceDtoMapper;
import com.punchclock.backend.modules.attendance.presentation.dto.ClockStatusResponse;
import com.punchclock.backend.modules.attendance.presentation.dto.StatusResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/users/{uid}")
public class ClockController {

    private final ClockService clockService;
    private final BalanceService balanceService;

    public ClockController(ClockService clockService, BalanceService balanceService) {
        this.clockService = clockService;
        this.balanceService = balanceService;
    }

    @Operation(summary = "Clock in", description = "Already clocked in is a successful no-op.")
    @PutMapping("/clock/in")
    public ResponseEntity<ClockStatusResponse> clockIn(@PathVariable("uid") Long uid) {
        return ResponseEntity.ok(AttendanceDtoMapper.toClockStatusResponse(clockService.clockIn(uid)));
    }

    @Operation(summary = "Clock out", description = "Closes the open session as a valid entry. Already clocked out is a successful no-op.")
    @PutMapping("/clock/out")
    public ResponseEntity<ClockStatusResponse> clockOut(@PathVariable("uid") Long uid) {
        return ResponseEntity.ok(AttendanceDtoMapper.toClockStatusResponse(clockService.clockOut(uid)));
    }

    @Operation(summary = "Current state with today's and month-to-date balance")
    @GetMapping("/status")
    public ResponseEntity<StatusResponse> getStatus(
            @PathVariable("uid") Long uid,
            @Parameter(description = "IANA zone for day boundaries; server default when omitted")
            @RequestParam(name = "zone", required = false) String zone
    ) {
        BalanceService.StatusSummary summary = balanceService.getStatusSummary(uid, AttendanceZones.parse(zone));
        return ResponseEntity.ok(AttendanceDtoMapper.toStatusResponse(summary));
    }
}
