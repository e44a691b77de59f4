package com.punchclock.backend.modules.attendance.application;

import com.punchclock.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

final class AttendanceProblems {

    static final String USER_STATE_NOT_FOUND = "USER_STATE_NOT_FOUND";
    static final String USER_STATE_EXISTS = "USER_STATE_EXISTS";
    static final String ENTRY_NOT_FOUND = "ENTRY_NOT_FOUND";

    private AttendanceProblems() {
    }

    static ProblemException userStateNotFound(Long uid) {
        return new ProblemException(HttpStatus.NOT_FOUND, USER_STATE_NOT_FOUND, "no user_states row for uid " + uid);
    }

    static ProblemException userStateExists(Long uid) {
        return new ProblemException(HttpStatus.CONFLICT, USER_STATE_EXISTS, "uid " + uid + " already has a state row");
    }

    static ProblemException entryNotFound(Long eid) {
        return new ProblemException(HttpStatus.NOT_FOUND, ENTRY_NOT_FOUND, "no entry with eid " + eid);
    }
}
