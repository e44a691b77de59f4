package com.punchclock.backend.modules.attendance.application;

import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.WorkEntryRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Administrative corrections to the ledger. These bypass the clock state machine: nothing checks
 * the edited bounds or the owner's state row.
 */
@Service
@Transactional
public class EntryAdminService {

    private static final Logger log = LoggerFactory.getLogger(EntryAdminService.class);

    private final WorkEntryRepository workEntryRepository;

    public EntryAdminService(WorkEntryRepository workEntryRepository) {
        this.workEntryRepository = workEntryRepository;
    }

    public WorkEntry editEntry(Long eid, long from, long to) {
        WorkEntry entry = workEntryRepository.findById(eid)
                .orElseThrow(() -> AttendanceProblems.entryNotFound(eid));
        log.info("Overriding entry {} of uid={}: {}..{} -> {}..{}",
                eid, entry.getUid(), entry.getFromSeconds(), entry.getToSeconds(), from, to);
        entry.overrideBounds(from, to);
        return entry;
    }

    public void deleteEntry(Long eid) {
        WorkEntry entry = workEntryRepository.findById(eid)
                .orElseThrow(() -> AttendanceProblems.entryNotFound(eid));
        workEntryRepository.delete(entry);
        log.info("Deleted entry {} of uid={} ({}..{}, valid={})",
                eid, entry.getUid(), entry.getFromSeconds(), entry.getToSeconds(), entry.isValid());
    }
}
