package com.punchclock.backend.modules.attendance.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import com.punchclock.backend.modules.attendance.domain.ClockState;
import com.punchclock.backend.modules.attendance.domain.UserState;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserStateRepository extends JpaRepository<UserState, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select us from UserState us where us.uid = :uid")
    Optional<UserState> findByUidForUpdate(@Param("uid") Long uid);

    @Query("""
            select us.uid as uid, us.since as since
              from UserState us
             where us.state = :state
             order by us.uid
            """)
    List<OpenSessionRow> findSessionsInState(@Param("state") ClockState state);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            update UserState us
               set us.state = :target,
                   us.since = :now
             where us.state = :current
               and us.uid in :uids
            """)
    int transitionAll(
            @Param("uids") Collection<Long> uids,
            @Param("current") ClockState current,
            @Param("target") ClockState target,
            @Param("now") long now
    );

    /**
     * Raw scan row for the disqualification sweep; {@code since} is boxed so a malformed row can be
     * detected and skipped instead of failing the whole scan.
     */
    interface OpenSessionRow {
        Long getUid();

        Long getSince();
    }
}
