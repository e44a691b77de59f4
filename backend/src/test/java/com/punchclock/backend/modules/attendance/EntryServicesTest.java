package com.punchclock.backend.modules.attendance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;

import com.punchclock.backend.global.error.ProblemException;
import com.punchclock.backend.modules.attendance.application.AttendanceZones;
import com.punchclock.backend.modules.attendance.application.EntryAdminService;
import com.punchclock.backend.modules.attendance.application.EntryQueryService;
import com.punchclock.backend.modules.attendance.application.UserStateProvisioningService;
import com.punchclock.backend.modules.attendance.domain.ClockState;
import com.punchclock.backend.modules.attendance.domain.ClockStatus;
import com.punchclock.backend.modules.attendance.domain.UserState;
import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.WorkEntryRepository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class EntryServicesTest {

    private static final long DAY_START = 1_736_899_200L; // 2025-01-15T00:00:00Z
    private static final long HOUR = 3_600L;

    @Mock
    private WorkEntryRepository workEntryRepository;

    @Mock
    private UserStateRepository userStateRepository;

    @Test
    @DisplayName("entries are grouped by the local day their session started")
    void groupsByStartDay() {
        EntryQueryService service = new EntryQueryService(workEntryRepository, new AttendanceZones("UTC"));
        WorkEntry morning = WorkEntry.valid(1L, DAY_START + 9 * HOUR, DAY_START + 12 * HOUR);
        WorkEntry overnight = WorkEntry.disqualified(1L, DAY_START + 22 * HOUR, DAY_START + 27 * HOUR);
        WorkEntry nextDay = WorkEntry.valid(1L, DAY_START + 33 * HOUR, DAY_START + 35 * HOUR);
        when(workEntryRepository.findByUidOrderByFromSecondsAscEidAsc(1L)).thenReturn(List.of(morning, overnight, nextDay));

        SortedMap<LocalDate, List<WorkEntry>> days = service.listEntries(1L, null);

        assertThat(days.keySet()).containsExactly(LocalDate.of(2025, 1, 15), LocalDate.of(2025, 1, 16));
        assertThat(days.get(LocalDate.of(2025, 1, 15))).containsExactly(morning, overnight);
        assertThat(days.get(LocalDate.of(2025, 1, 16))).containsExactly(nextDay);
    }

    @Test
    @DisplayName("grouping follows the requested zone")
    void groupsInRequestedZone() {
        EntryQueryService service = new EntryQueryService(workEntryRepository, new AttendanceZones("UTC"));
        WorkEntry lateEvening = WorkEntry.valid(1L, DAY_START - 2 * HOUR, DAY_START - HOUR);
        when(workEntryRepository.findByUidOrderByFromSecondsAscEidAsc(1L)).thenReturn(List.of(lateEvening));

        SortedMap<LocalDate, List<WorkEntry>> days = service.listEntries(1L, ZoneId.of("Asia/Tokyo"));

        assertThat(days.firstKey()).isEqualTo(LocalDate.of(2025, 1, 15));
    }

    @Test
    @DisplayName("a user without entries gets an empty listing")
    void emptyListing() {
        EntryQueryService service = new EntryQueryService(workEntryRepository, new AttendanceZones("UTC"));
        when(workEntryRepository.findByUidOrderByFromSecondsAscEidAsc(2L)).thenReturn(List.of());

        assertThat(service.listEntries(2L, null)).isEmpty();
    }

    @Test
    @DisplayName("an edit replaces both bounds without checking their order")
    void editEntry() {
        EntryAdminService service = new EntryAdminService(workEntryRepository);
        WorkEntry entry = WorkEntry.valid(1L, DAY_START, DAY_START + HOUR);
        when(workEntryRepository.findById(10L)).thenReturn(Optional.of(entry));

        WorkEntry edited = service.editEntry(10L, DAY_START + 5 * HOUR, DAY_START + 4 * HOUR);

        assertThat(edited.getFromSeconds()).isEqualTo(DAY_START + 5 * HOUR);
        assertThat(edited.getToSeconds()).isEqualTo(DAY_START + 4 * HOUR);
        assertThat(edited.isValid()).isTrue();
    }

    @Test
    @DisplayName("editing or deleting a missing entry is not found")
    void missingEntry() {
        EntryAdminService service = new EntryAdminService(workEntryRepository);
        when(workEntryRepository.findById(11L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.editEntry(11L, 0L, 1L))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getCode()).isEqualTo("ENTRY_NOT_FOUND"));
        assertThatThrownBy(() -> service.deleteEntry(11L))
                .isInstanceOf(ProblemException.class);
        verify(workEntryRepository, never()).delete(any());
    }

    @Test
    @DisplayName("delete removes the entry")
    void deleteEntry() {
        EntryAdminService service = new EntryAdminService(workEntryRepository);
        WorkEntry entry = WorkEntry.valid(1L, DAY_START, DAY_START + HOUR);
        when(workEntryRepository.findById(12L)).thenReturn(Optional.of(entry));

        service.deleteEntry(12L);

        verify(workEntryRepository).delete(entry);
    }

    @Test
    @DisplayName("new users start clocked out as of now")
    void provisionUser() {
        UserStateProvisioningService service = new UserStateProvisioningService(
                userStateRepository, Clock.fixed(Instant.ofEpochSecond(DAY_START), ZoneOffset.UTC));
        when(userStateRepository.existsById(3L)).thenReturn(false);
        when(userStateRepository.save(any(UserState.class))).thenAnswer(invocation -> invocation.getArgument(0));

        ClockStatus status = service.provision(3L);

        assertThat(status).isEqualTo(new ClockStatus(3L, ClockState.OUT, DAY_START));
    }

    @Test
    @DisplayName("provisioning an existing user conflicts")
    void provisionExisting() {
        UserStateProvisioningService service = new UserStateProvisioningService(
                userStateRepository, Clock.fixed(Instant.ofEpochSecond(DAY_START), ZoneOffset.UTC));
        when(userStateRepository.existsById(3L)).thenReturn(true);

        assertThatThrownBy(() -> service.provision(3L))
                .isInstanceOf(ProblemException.class)
                .satisfies(ex -> assertThat(((ProblemException) ex).getStatusCode()).isEqualTo(HttpStatus.CONFLICT));
        verify(userStateRepository, never()).save(any());
    }
}
