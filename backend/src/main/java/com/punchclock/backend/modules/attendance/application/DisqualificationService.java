package com.punchclock.backend.modules.attendance.application;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

import com.punchclock.backend.global.common.time.UnixTime;
import com.punchclock.backend.global.error.MalformedRowException;
import com.punchclock.backend.modules.attendance.domain.ClockState;
import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository.OpenSessionRow;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.WorkEntryRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Force-closes every open session as an invalid entry, then flips the affected users to OUT.
 *
 * <p>The two steps are separate transactions. Each entry insert commits on its own and a failed
 * insert is logged and skipped. The state update runs afterwards for every scanned user,
 * including those whose insert failed, in batches of {@link #FLIP_BATCH_SIZE} uids. A failed
 * batch is logged and the remaining batches still run. A crash between the steps leaves invalid
 * entries for users still shown as IN. That window is accepted. A later clock-out or sweep closes
 * those sessions again.
 */
@Service
public class DisqualificationService {

    private static final Logger log = LoggerFactory.getLogger(DisqualificationService.class);

    // stays well below the PostgreSQL limit of 32767 bind parameters per statement
    public static final int FLIP_BATCH_SIZE = 1_000;

    private final UserStateRepository userStateRepository;
    private final WorkEntryRepository workEntryRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public DisqualificationService(
            UserStateRepository userStateRepository,
            WorkEntryRepository workEntryRepository,
            TransactionTemplate transactionTemplate,
            Clock clock
    ) {
        this.userStateRepository = userStateRepository;
        this.workEntryRepository = workEntryRepository;
        this.transactionTemplate = transactionTemplate;
        this.clock = clock;
    }

    public SweepResult runDisqualificationSweep() {
        long now = UnixTime.now(clock);
        List<OpenSessionRow> open = userStateRepository.findSessionsInState(ClockState.IN);
        if (open.isEmpty()) {
            return new SweepResult(now, 0, 0, 0, 0);
        }

        List<Long> scannedUids = new ArrayList<>(open.size());
        int disqualified = 0;
        int failed = 0;
        for (OpenSessionRow row : open) {
            scannedUids.add(row.getUid());
            try {
                insertDisqualifiedEntry(row, now);
                disqualified++;
            } catch (MalformedRowException ex) {
                log.warn("[Sweep] skipping row: {}", ex.getDetailMessage());
                failed++;
            } catch (RuntimeException ex) {
                log.warn("[Sweep] failed to add disqualifying entry for uid={}: {}", row.getUid(), ex.getMessage(), ex);
                failed++;
            }
        }

        int flipped = 0;
        for (int offset = 0; offset < scannedUids.size(); offset += FLIP_BATCH_SIZE) {
            List<Long> batch = scannedUids.subList(offset, Math.min(offset + FLIP_BATCH_SIZE, scannedUids.size()));
            try {
                Integer updated = transactionTemplate.execute(status ->
                        userStateRepository.transitionAll(batch, ClockState.IN, ClockState.OUT, now));
                flipped += updated != null ? updated : 0;
            } catch (RuntimeException ex) {
                log.error("[Sweep] failed to clock out {} disqualified users (uids {}..{})",
                        batch.size(), batch.get(0), batch.get(batch.size() - 1), ex);
            }
        }

        SweepResult result = new SweepResult(now, open.size(), disqualified, failed, flipped);
        log.info("[Sweep] at={} scanned={} disqualified={} failed={} flipped={}",
                now, result.scanned(), result.disqualified(), result.failed(), result.flipped());
        return result;
    }

    private void insertDisqualifiedEntry(OpenSessionRow row, long now) {
        if (row.getSince() == null) {
            throw new MalformedRowException("user_states", String.valueOf(row.getUid()), "since_unix_s is null");
        }
        transactionTemplate.executeWithoutResult(status ->
                workEntryRepository.save(WorkEntry.disqualified(row.getUid(), row.getSince(), now)));
    }

    public record SweepResult(long ranAt, int scanned, int disqualified, int failed, int flipped) {
    }
}
