package io.github.riemr.autoschedule.infrastructure.repository;

import io.github.riemr.autoschedule.domain.model.OccurrenceKey;
import io.github.riemr.autoschedule.infrastructure.mapper.AttendanceMapper;
import io.github.riemr.autoschedule.infrastructure.mapper.AttendanceOccurrenceMapper;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.AttendanceOccurrence;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class AttendanceOccurrenceRepositoryImplTest {

    private static final LocalDate SUNDAY = LocalDate.of(2026, 10, 18);

    private final AttendanceOccurrenceMapper occurrenceMapper = mock(AttendanceOccurrenceMapper.class);
    private final AttendanceOccurrenceRepositoryImpl repository = new AttendanceOccurrenceRepositoryImpl(occurrenceMapper);

    @Test
    void getOrAdd_insertsThenReadsBackByKey() {
        AttendanceOccurrence existing = new AttendanceOccurrence();
        existing.setId(42L);
        when(occurrenceMapper.selectByKey(SUNDAY, 10L, 200L, 1L)).thenReturn(existing);

        AttendanceOccurrence result = repository.getOrAdd(new OccurrenceKey(SUNDAY, 10L, 200L, 1L));

        assertThat(result.getId()).isEqualTo(42L);
        var order = inOrder(occurrenceMapper);
        order.verify(occurrenceMapper).insertIfAbsent(SUNDAY, 10L, 200L, 1L);
        order.verify(occurrenceMapper).selectByKey(SUNDAY, 10L, 200L, 1L);
    }

    @Test
    void getOrAdd_failsWhenRowIsMissingAfterInsert() {
        assertThatThrownBy(() -> repository.getOrAdd(new OccurrenceKey(SUNDAY, 10L, 200L, 1L)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("date=2026-10-18");
    }

    @Test
    void findByIds_emptyInput_skipsQuery() {
        assertThat(repository.findByIds(List.of())).isEmpty();
        verify(occurrenceMapper, never()).selectByIds(anyList());
    }

    @Test
    void confirmScheduled_stampsClock_andRejectsMissingRow() {
        AttendanceMapper attendanceMapper = mock(AttendanceMapper.class);
        Clock clock = Clock.fixed(Instant.parse("2026-10-14T12:00:00Z"), ZoneOffset.UTC);
        AttendanceRepositoryImpl attendances = new AttendanceRepositoryImpl(attendanceMapper, clock);
        when(attendanceMapper.confirmScheduled(7L, LocalDateTime.of(2026, 10, 14, 12, 0))).thenReturn(1);

        attendances.confirmScheduled(7L);

        assertThatThrownBy(() -> attendances.confirmScheduled(8L)).isInstanceOf(IllegalStateException.class);
    }
}
