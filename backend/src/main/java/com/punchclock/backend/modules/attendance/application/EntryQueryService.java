package com.punchclock.backend.modules.attendance.application;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import com.punchclock.backend.global.common.time.UnixTime;
import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.WorkEntryRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class EntryQueryService {

    private final WorkEntryRepository workEntryRepository;
    private final AttendanceZones zones;

    public EntryQueryService(WorkEntryRepository workEntryRepository, AttendanceZones zones) {
        this.workEntryRepository = workEntryRepository;
        this.zones = zones;
    }

    /**
     * All entries of the user keyed by the local day their session started. An entry crossing
     * midnight stays on the day of its {@code from}.
     */
    public SortedMap<LocalDate, List<WorkEntry>> listEntries(Long uid, ZoneId zone) {
        ZoneId resolved = zones.resolve(zone);
        SortedMap<LocalDate, List<WorkEntry>> days = new TreeMap<>();
        for (WorkEntry entry : workEntryRepository.findByUidOrderByFromSecondsAscEidAsc(uid)) {
            LocalDate day = UnixTime.localDate(entry.getFromSeconds(), resolved);
            days.computeIfAbsent(day, key -> new ArrayList<>()).add(entry);
        }
        return days;
    }
}
