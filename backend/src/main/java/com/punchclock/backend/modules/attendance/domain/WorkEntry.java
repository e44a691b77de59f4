package com.punchclock.backend.modules.attendance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.type.NumericBooleanConverter;

/**
 * Ledger row for one closed session. Valid entries come from clock-out, invalid ones from the
 * disqualification sweep. Only the administrative override changes an entry after creation.
 */
@Entity
@Table(name = "entries")
public class WorkEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "eid", nullable = false, updatable = false)
    private Long eid;

    @Column(name = "uid", nullable = false, updatable = false)
    private Long uid;

    @Column(name = "from_unix_s", nullable = false)
    private long fromSeconds;

    @Column(name = "to_unix_s", nullable = false)
    private long toSeconds;

    @Convert(converter = NumericBooleanConverter.class)
    @Column(name = "valid", nullable = false)
    private boolean valid;

    protected WorkEntry() {
    }

    private WorkEntry(Long uid, long fromSeconds, long toSeconds, boolean valid) {
        this.uid = uid;
        this.fromSeconds = fromSeconds;
        this.toSeconds = toSeconds;
        this.valid = valid;
    }

    public static WorkEntry valid(Long uid, long fromSeconds, long toSeconds) {
        return new WorkEntry(uid, fromSeconds, toSeconds, true);
    }

    public static WorkEntry disqualified(Long uid, long fromSeconds, long toSeconds) {
        return new WorkEntry(uid, fromSeconds, toSeconds, false);
    }

    public Long getEid() {
        return eid;
    }

    public Long getUid() {
        return uid;
    }

    public long getFromSeconds() {
        return fromSeconds;
    }

    public long getToSeconds() {
        return toSeconds;
    }

    public boolean isValid() {
        return valid;
    }

    public long durationSeconds() {
        return toSeconds - fromSeconds;
    }

    // administrative override only; bounds are not checked against each other
    public void overrideBounds(long fromSeconds, long toSeconds) {
        this.fromSeconds = fromSeconds;
        this.toSeconds = toSeconds;
    }
}
