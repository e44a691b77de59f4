package com.punchclock.backend.modules.attendance.infrastructure.persistence;

import java.util.List;

import com.punchclock.backend.modules.attendance.domain.WorkEntry;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkEntryRepository extends JpaRepository<WorkEntry, Long> {

    List<WorkEntry> findByUidOrderByFromSecondsAscEidAsc(Long uid);

    long countByUid(Long uid);

    /**
     * Entries of the given validity whose bounds fall within {@code [start, end]}. Callers apply the
     * strict window edges themselves.
     */
    @Query("""
            select e
              from WorkEntry e
             where e.uid = :uid
               and e.valid = :valid
               and e.fromSeconds >= :start
               and e.toSeconds <= :end
             order by e.fromSeconds
            """)
    List<WorkEntry> findWithinBounds(
            @Param("uid") Long uid,
            @Param("valid") boolean valid,
            @Param("start") long start,
            @Param("end") long end
    );
}
