package com.punchclock.backend.modules.attendance.domain;

public record ClockStatus(Long uid, ClockState state, long since) {

    /**
     * Seconds the current session has been open at {@code now}; zero while clocked out.
     */
    public long openSessionSeconds(long now) {
        return state.isIn() ? now - since : 0L;
    }
}
