package com.punchclock.backend.modules.attendance.application;

import java.time.Clock;
import java.util.function.Function;

import com.punchclock.backend.global.common.time.UnixTime;
import com.punchclock.backend.global.error.MalformedRowException;
import com.punchclock.backend.modules.attendance.domain.ClockStatus;
import com.punchclock.backend.modules.attendance.domain.UserState;
import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.WorkEntryRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionSystemException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Clock-in/out state machine. Each transition locks the user's state row, so concurrent calls for
 * one user serialize and the later one takes the already-in/already-out branch. Clock-out writes
 * the entry and the state flip in the same transaction with the same timestamp.
 */
@Service
public class ClockService {

    private static final Logger log = LoggerFactory.getLogger(ClockService.class);

    private final UserStateRepository userStateRepository;
    private final WorkEntryRepository workEntryRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ClockService(
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

    public ClockStatus clockIn(Long uid) {
        return transition(uid, "clock-in", state -> {
            if (state.requireState().isIn()) {
                log.debug("uid={} already clocked in since {}", uid, state.getSince());
                return state.toStatus();
            }
            long now = UnixTime.now(clock);
            state.clockIn(now);
            log.debug("uid={} clocked in at {}", uid, now);
            return state.toStatus();
        });
    }

    public ClockStatus clockOut(Long uid) {
        return transition(uid, "clock-out", state -> {
            if (!state.requireState().isIn()) {
                log.debug("uid={} already clocked out since {}", uid, state.getSince());
                return state.toStatus();
            }
            long now = UnixTime.now(clock);
            WorkEntry entry = workEntryRepository.save(state.clockOut(now));
            log.debug("uid={} clocked out at {}, entry {} covers {}..{}",
                    uid, now, entry.getEid(), entry.getFromSeconds(), entry.getToSeconds());
            return state.toStatus();
        });
    }

    private ClockStatus transition(Long uid, String name, Function<UserState, ClockStatus> change) {
        try {
            return transactionTemplate.execute(status -> {
                UserState state = lockState(uid, name);
                try {
                    return change.apply(state);
                } catch (DataAccessException ex) {
                    throw failure("write", name, uid, ex);
                }
            });
        } catch (CannotCreateTransactionException ex) {
            throw new ClockTransitionException("begin", name, uid, ex);
        } catch (TransactionSystemException ex) {
            if (ex.getApplicationException() != null) {
                log.error("Rollback of {} for uid={} failed after: {}", name, uid,
                        ex.getApplicationException().getMessage(), ex);
                throw new ClockTransitionException("roll back", name, uid, ex);
            }
            throw new ClockTransitionException("commit", name, uid, ex);
        } catch (TransactionException ex) {
            throw new ClockTransitionException("commit", name, uid, ex);
        } catch (DataAccessException ex) {
            // flush failures surface from commit
            throw failure("commit", name, uid, ex);
        }
    }

    private UserState lockState(Long uid, String name) {
        try {
            return userStateRepository.findByUidForUpdate(uid)
                    .orElseThrow(() -> AttendanceProblems.userStateNotFound(uid));
        } catch (DataAccessException ex) {
            throw failure("look up", name, uid, ex);
        }
    }

    // malformed rows are not retryable
    private RuntimeException failure(String step, String name, Long uid, DataAccessException ex) {
        if (ex.getMostSpecificCause() instanceof MalformedRowException malformed) {
            log.error("{} for uid={} hit a malformed row: {}", name, uid, malformed.getDetailMessage());
            return malformed;
        }
        return new ClockTransitionException(step, name, uid, ex);
    }
}
