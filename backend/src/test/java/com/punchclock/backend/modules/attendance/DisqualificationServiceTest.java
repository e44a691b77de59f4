package com.punchclock.backend.modules.attendance;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.stream.LongStream;

import com.punchclock.backend.modules.attendance.application.DisqualificationService;
import com.punchclock.backend.modules.attendance.application.DisqualificationService.SweepResult;
import com.punchclock.backend.modules.attendance.domain.ClockState;
import com.punchclock.backend.modules.attendance.domain.WorkEntry;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.UserStateRepository.OpenSessionRow;
import com.punchclock.backend.modules.attendance.infrastructure.persistence.WorkEntryRepository;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

@ExtendWith(MockitoExtension.class)
class DisqualificationServiceTest {

    private static final long NOW = 1_736_910_000L; // 2025-01-15T03:00:00Z

    @Mock
    private UserStateRepository userStateRepository;

    @Mock
    private WorkEntryRepository workEntryRepository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private DisqualificationService service;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        service = new DisqualificationService(
                userStateRepository,
                workEntryRepository,
                new TransactionTemplate(transactionManager),
                Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC)
        );
    }

    @Test
    @DisplayName("every open session becomes an invalid entry and its user is clocked out")
    void disqualifiesOpenSessions() {
        when(userStateRepository.findSessionsInState(ClockState.IN))
                .thenReturn(List.of(row(1L, NOW - 20_000), row(2L, NOW - 5_000)));
        when(userStateRepository.transitionAll(anyCollection(), eq(ClockState.IN), eq(ClockState.OUT), eq(NOW)))
                .thenReturn(2);

        SweepResult result = service.runDisqualificationSweep();

        ArgumentCaptor<WorkEntry> captor = ArgumentCaptor.forClass(WorkEntry.class);
        verify(workEntryRepository, times(2)).save(captor.capture());
        assertThat(captor.getAllValues())
                .allSatisfy(entry -> {
                    assertThat(entry.isValid()).isFalse();
                    assertThat(entry.getToSeconds()).isEqualTo(NOW);
                })
                .extracting(WorkEntry::getFromSeconds)
                .containsExactly(NOW - 20_000, NOW - 5_000);
        assertThat(result).isEqualTo(new SweepResult(NOW, 2, 2, 0, 2));
    }

    @Test
    @DisplayName("nothing open means nothing written")
    void noOpenSessions() {
        when(userStateRepository.findSessionsInState(ClockState.IN)).thenReturn(List.of());

        SweepResult result = service.runDisqualificationSweep();

        assertThat(result.scanned()).isZero();
        verify(workEntryRepository, never()).save(any());
        verify(userStateRepository, never()).transitionAll(anyCollection(), any(), any(), anyLong());
    }

    @Test
    @DisplayName("a malformed row is skipped but the rest of the sweep continues")
    @SuppressWarnings("unchecked")
    void skipsMalformedRow() {
        when(userStateRepository.findSessionsInState(ClockState.IN))
                .thenReturn(List.of(row(1L, null), row(2L, NOW - 5_000)));
        when(userStateRepository.transitionAll(anyCollection(), eq(ClockState.IN), eq(ClockState.OUT), eq(NOW)))
                .thenReturn(2);

        SweepResult result = service.runDisqualificationSweep();

        verify(workEntryRepository, times(1)).save(any(WorkEntry.class));
        assertThat(result.disqualified()).isEqualTo(1);
        assertThat(result.failed()).isEqualTo(1);

        ArgumentCaptor<Collection<Long>> uids = ArgumentCaptor.forClass(Collection.class);
        verify(userStateRepository).transitionAll(uids.capture(), eq(ClockState.IN), eq(ClockState.OUT), eq(NOW));
        assertThat(uids.getValue()).containsExactly(1L, 2L);
    }

    @Test
    @DisplayName("a failed insert is counted and does not stop the state flip")
    void insertFailureIsCounted() {
        when(userStateRepository.findSessionsInState(ClockState.IN))
                .thenReturn(List.of(row(1L, NOW - 100), row(2L, NOW - 200)));
        when(workEntryRepository.save(any(WorkEntry.class)))
                .thenThrow(new QueryTimeoutException("timeout"))
                .thenAnswer(invocation -> invocation.getArgument(0));
        when(userStateRepository.transitionAll(anyCollection(), eq(ClockState.IN), eq(ClockState.OUT), eq(NOW)))
                .thenReturn(2);

        SweepResult result = service.runDisqualificationSweep();

        assertThat(result).isEqualTo(new SweepResult(NOW, 2, 1, 1, 2));
        verify(transactionManager).rollback(any());
    }

    @Test
    @DisplayName("a failed bulk update is logged and reported as zero flipped")
    void bulkUpdateFailure() {
        when(userStateRepository.findSessionsInState(ClockState.IN)).thenReturn(List.of(row(1L, NOW - 100)));
        when(userStateRepository.transitionAll(anyCollection(), eq(ClockState.IN), eq(ClockState.OUT), eq(NOW)))
                .thenThrow(new QueryTimeoutException("timeout"));

        SweepResult result = service.runDisqualificationSweep();

        assertThat(result.disqualified()).isEqualTo(1);
        assertThat(result.flipped()).isZero();
    }

    @Test
    @DisplayName("the state flip runs in bounded batches and a failed batch does not stop the rest")
    @SuppressWarnings("unchecked")
    void flipsInBatches() {
        int open = 2 * DisqualificationService.FLIP_BATCH_SIZE + 500;
        List<OpenSessionRow> rows = LongStream.rangeClosed(1, open)
                .mapToObj(uid -> row(uid, NOW - 100))
                .toList();
        when(userStateRepository.findSessionsInState(ClockState.IN)).thenReturn(rows);
        when(userStateRepository.transitionAll(anyCollection(), eq(ClockState.IN), eq(ClockState.OUT), eq(NOW)))
                .thenAnswer(invocation -> ((Collection<Long>) invocation.getArgument(0)).size())
                .thenThrow(new QueryTimeoutException("timeout"))
                .thenAnswer(invocation -> ((Collection<Long>) invocation.getArgument(0)).size());

        SweepResult result = service.runDisqualificationSweep();

        ArgumentCaptor<Collection<Long>> batches = ArgumentCaptor.forClass(Collection.class);
        verify(userStateRepository, times(3))
                .transitionAll(batches.capture(), eq(ClockState.IN), eq(ClockState.OUT), eq(NOW));
        assertThat(batches.getAllValues())
                .extracting(Collection::size)
                .containsExactly(DisqualificationService.FLIP_BATCH_SIZE, DisqualificationService.FLIP_BATCH_SIZE, 500);
        assertThat(batches.getAllValues().get(2)).first().isEqualTo(2L * DisqualificationService.FLIP_BATCH_SIZE + 1);
        assertThat(result.scanned()).isEqualTo(open);
        assertThat(result.flipped()).isEqualTo(DisqualificationService.FLIP_BATCH_SIZE + 500);
    }

    private static OpenSessionRow row(Long uid, Long since) {
        return new OpenSessionRow() {
            @Override
            public Long getUid() {
                return uid;
            }

            @Override
            public Long getSince() {
                return since;
            }
        };
    }
}
