package com.punchclock.backend.modules.attendance.application;

import java.time.Clock;

import com.punchclock.backend.global.common.time.UnixTime;
import com.punchclock.backend.modules.attendance.domain.ClockState;
import com.punchclock.backend.modules.attendance.domain.ClockStatus;
import com.punchclock.backend.modules.attendance.domain.UserState;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates the state row a user needs before the first clock-in. New users start clocked out.
 */
@Service
public class UserStateProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(UserStateProvisioningService.class);

    private final UserStateRepository userStateRepository;
    private final Clock clock;

    public UserStateProvisioningService(UserStateRepository userStateRepository, Clock clock) {
        this.userStateRepository = userStateRepository;
        this.clock = clock;
    }

    @Transactional
    public ClockStatus provision(Long uid) {
        if (userStateRepository.existsById(uid)) {
            throw AttendanceProblems.userStateExists(uid);
        }
        UserState state = userStateRepository.save(new UserState(uid, ClockState.OUT, UnixTime.now(clock)));
        log.info("Provisioned state row for uid={}", uid);
        return state.toStatus();
    }
}
