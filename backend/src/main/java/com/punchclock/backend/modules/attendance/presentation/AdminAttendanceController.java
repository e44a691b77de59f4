package com.punchclock.backend.modules.attendance.presentation;

import com.punchclock.backend.modules.attendance.application.DisqualificationService;
import com.punchclock.backend.modules.attendance.application.EntryAdminService;
import com.punchclock.backend.modules.attendance.application.UserStateProvisioningService;
import com.punchclock.backend.modules.attendance.presentation.dto.AttendanceDtoMapper;
import com.punchclock.backend.modules.attendance.presentation.dto.ClockStatusResponse;
import com.punchclock.backend.modules.attendance.presentation.dto.EditEntryRequest;
import com.punchclock.backend.modules.attendance.presentation.dto.EntryResponse;
import com.punchclock.backend.modules.attendance.presentation.dto.SweepResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/admin")
public class AdminAttendanceController {

    private final EntryAdminService entryAdminService;
    private final UserStateProvisioningService provisioningService;
    private final DisqualificationService disqualificationService;

    public AdminAttendanceController(
            EntryAdminService entryAdminService,
            UserStateProvisioningService provisioningService,
            DisqualificationService disqualificationService
    ) {
        this.entryAdminService = entryAdminService;
        this.provisioningService = provisioningService;
        this.disqualificationService = disqualificationService;
    }

    @Operation(summary = "Provision a clocked-out state row for a new user")
    @PostMapping("/users/{uid}/state")
    public ResponseEntity<ClockStatusResponse> provision(@PathVariable("uid") Long uid) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(AttendanceDtoMapper.toClockStatusResponse(provisioningService.provision(uid)));
    }

    @Operation(summary = "Overwrite an entry's bounds", description = "Bypasses all consistency checks.")
    @PatchMapping("/entries/{eid}")
    public ResponseEntity<EntryResponse> editEntry(
            @PathVariable("eid") Long eid,
            @Valid @RequestBody EditEntryRequest request
    ) {
        return ResponseEntity.ok(AttendanceDtoMapper.toEntryResponse(
                entryAdminService.editEntry(eid, request.from(), request.to())));
    }

    @DeleteMapping("/entries/{eid}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("eid") Long eid) {
        entryAdminService.deleteEntry(eid);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Run the disqualification sweep now")
    @PostMapping("/disqualification/run")
    public ResponseEntity<SweepResponse> runDisqualification() {
        return ResponseEntity.ok(AttendanceDtoMapper.toSweepResponse(
                disqualificationService.runDisqualificationSweep()));
    }
}
