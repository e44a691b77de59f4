package com.punchclock.backend.modules.attendance.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;

import com.punchclock.backend.global.common.time.UnixTime;
import com.punchclock.backend.modules.attendance.domain.ClockStatus;
import com.punchclock.backend.modules.attendance.domain.ExpectedHoursPolicy;
import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.domain.WorkWindow;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.WorkEntryRepository;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Worked-time balance over a day or month-to-date window: valid entry seconds strictly inside
 * the window, minus the expected weekday hours, plus the still-open session if the user is in.
 *
 * <p>Entries and state are read separately without locks. A session closing between the two
 * reads can be counted twice or not at all in that one result.
 */
@Service
public class BalanceService {

    private final UserStateRepository userStateRepository;
    private final WorkEntryRepository workEntryRepository;
    private final ExpectedHoursPolicy expectedHoursPolicy;
    private final AttendanceZones zones;
    private final Clock clock;

    @Autowired
    public BalanceService(
            UserStateRepository userStateRepository,
            WorkEntryRepository workEntryRepository,
            AttendanceZones zones,
            Clock clock,
            @Value("${app.attendance.expected-seconds-per-weekday:28800}") long expectedSecondsPerWeekday
    ) {
        this(userStateRepository, workEntryRepository, zones, clock, new ExpectedHoursPolicy(expectedSecondsPerWeekday));
    }

    public BalanceService(
            UserStateRepository userStateRepository,
            WorkEntryRepository workEntryRepository,
            AttendanceZones zones,
            Clock clock,
            ExpectedHoursPolicy expectedHoursPolicy
    ) {
        this.userStateRepository = userStateRepository;
        this.workEntryRepository = workEntryRepository;
        this.zones = zones;
        this.clock = clock;
        this.expectedHoursPolicy = expectedHoursPolicy;
    }

    public long getDeltaForDay(Long uid, LocalDate date, ZoneId zone) {
        return getDayReport(uid, date, zone).delta();
    }

    public long getDeltaForMonth(Long uid, LocalDate date, ZoneId zone) {
        return getMonthReport(uid, date, zone).delta();
    }

    public BalanceReport getDayReport(Long uid, LocalDate date, ZoneId zone) {
        WorkWindow window = WorkWindow.day(date, zones.resolve(zone));
        long worked = workedSeconds(uid, window);
        return report(uid, window, worked, loadStatus(uid), UnixTime.now(clock));
    }

    public BalanceReport getMonthReport(Long uid, LocalDate date, ZoneId zone) {
        WorkWindow window = WorkWindow.monthToDate(date, zones.resolve(zone));
        long worked = workedSeconds(uid, window);
        return report(uid, window, worked, loadStatus(uid), UnixTime.now(clock));
    }

    /**
     * Current state plus today's and month-to-date balances, all evaluated at the same instant.
     */
    public StatusSummary getStatusSummary(Long uid, ZoneId zone) {
        ZoneId resolved = zones.resolve(zone);
        long now = UnixTime.now(clock);
        LocalDate today = UnixTime.localDate(now, resolved);
        WorkWindow dayWindow = WorkWindow.day(today, resolved);
        WorkWindow monthWindow = WorkWindow.monthToDate(today, resolved);
        long workedToday = workedSeconds(uid, dayWindow);
        long workedThisMonth = workedSeconds(uid, monthWindow);
        ClockStatus status = loadStatus(uid);
        return new StatusSummary(
                status,
                now,
                report(uid, dayWindow, workedToday, status, now),
                report(uid, monthWindow, workedThisMonth, status, now)
        );
    }

    private long workedSeconds(Long uid, WorkWindow window) {
        return workEntryRepository.findWithinBounds(uid, true, window.start(), window.end()).stream()
                .filter(entry -> window.strictlyContains(entry.getFromSeconds(), entry.getToSeconds()))
                .mapToLong(WorkEntry::durationSeconds)
                .sum();
    }

    private BalanceReport report(Long uid, WorkWindow window, long worked, ClockStatus status, long now) {
        long expected = expectedHoursPolicy.expectedSeconds(window);
        long open = status.openSessionSeconds(now);
        return new BalanceReport(uid, window, worked, expected, open, worked - expected + open);
    }

    private ClockStatus loadStatus(Long uid) {
        return userStateRepository.findById(uid)
                .orElseThrow(() -> AttendanceProblems.userStateNotFound(uid))
                .toStatus();
    }

    public record BalanceReport(
            Long uid,
            WorkWindow window,
            long workedSeconds,
            long expectedSeconds,
            long openSessionSeconds,
            long delta
    ) {
    }

    public record StatusSummary(ClockStatus status, long asOf, BalanceReport day, BalanceReport month) {
    }
}
