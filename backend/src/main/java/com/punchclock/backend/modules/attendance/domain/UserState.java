package com.punchclock.backend.modules.attendance.domain;

import com.punchclock.backend.global.error.MalformedRowException;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Current clock state of one user. {@code since} is the moment of the last transition and the
 * open lower bound of a session that has no entry yet.
 */
@Entity
@Table(name = "user_states")
public class UserState {

    @Id
    @Column(name = "uid", nullable = false, updatable = false)
    private Long uid;

    @Convert(converter = ClockStateConverter.class)
    @Column(name = "state", nullable = false, length = 1)
    private ClockState state;

    @Column(name = "since_unix_s", nullable = false)
    private Long since;

    protected UserState() {
    }

    public UserState(Long uid, ClockState state, long since) {
        this.uid = uid;
        this.state = state;
        this.since = since;
    }

    public Long getUid() {
        return uid;
    }

    public ClockState getState() {
        return state;
    }

    public Long getSince() {
        return since;
    }

    public long requireSince() {
        if (since == null) {
            throw new MalformedRowException("user_states", String.valueOf(uid), "since_unix_s is null");
        }
        return since;
    }

    public ClockState requireState() {
        if (state == null) {
            throw new MalformedRowException("user_states", String.valueOf(uid), "state is null");
        }
        return state;
    }

    public void clockIn(long now) {
        this.state = ClockState.IN;
        this.since = now;
    }

    /**
     * Closes the open session at {@code now} and returns the entry that materializes it.
     */
    public WorkEntry clockOut(long now) {
        WorkEntry entry = WorkEntry.valid(uid, requireSince(), now);
        this.state = ClockState.OUT;
        this.since = now;
        return entry;
    }

    public ClockStatus toStatus() {
        return new ClockStatus(uid, requireState(), requireSince());
    }
}
