package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.domain.model.OccurrenceKey;
import io.github.riemr.autoschedule.application.assign.AttendanceAutoAssigner;
import io.github.riemr.autoschedule.application.assign.GroupMemberAutoAssigner;
import io.github.riemr.autoschedule.application.dto.AutoScheduleCommand;
import io.github.riemr.autoschedule.application.dto.AutoScheduleResult;
import io.github.riemr.autoschedule.application.repository.GroupCatalogRepository;
import io.github.riemr.autoschedule.application.repository.GroupMemberRepository;
import io.github.riemr.autoschedule.application.repository.PersonAliasRepository;
import io.github.riemr.autoschedule.domain.model.RsvpStatus;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Attendance;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupMember;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.PersonAlias;
import io.github.riemr.autoschedule.support.CatalogFixtures;
import io.github.riemr.autoschedule.support.InMemoryAttendanceRepository;
import io.github.riemr.autoschedule.support.InMemoryOccurrenceRepository;
import io.github.riemr.autoschedule.support.RecordingTransactions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AutoScheduleServiceTest {

    private static final UUID GROUP_TYPE = UUID.fromString("a1b2c3d4-0000-0000-0000-000000000001");
    private static final UUID SCHEDULER = UUID.fromString("a1b2c3d4-0000-0000-0000-000000000002");
    // 2026-10-14 (水)
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-14T12:00:00Z"), ZoneOffset.UTC);

    private final GroupCatalogRepository catalog = mock(GroupCatalogRepository.class);
    private final PersonAliasRepository aliases = mock(PersonAliasRepository.class);
    private final GroupMemberRepository members = mock(GroupMemberRepository.class);
    private final InMemoryOccurrenceRepository occurrences = new InMemoryOccurrenceRepository();
    private final InMemoryAttendanceRepository attendances =
            new InMemoryAttendanceRepository(occurrences, Map.of(501L, 500L, 601L, 600L, 701L, 700L));
    private final RecordingTransactions transactions = new RecordingTransactions();

    @BeforeEach
    void setup() {
        when(catalog.findGroupTypeByGuid(GROUP_TYPE)).thenReturn(Optional.of(CatalogFixtures.groupType(1, GROUP_TYPE, true)));
        when(catalog.findGroupsByGroupType(1L)).thenReturn(List.of(CatalogFixtures.group(10, 1)));
        when(catalog.findGroupLocations(any())).thenReturn(List.of(CatalogFixtures.groupLocation(100, 10, 200, "Main", 0, 1L)));
        when(catalog.findSchedules(any())).thenReturn(List.of(CatalogFixtures.weekly(1, DayOfWeek.SUNDAY, LocalTime.of(9, 0))));

        PersonAlias alias = new PersonAlias();
        alias.setId(901L);
        alias.setPersonId(900L);
        alias.setPrimaryAlias(true);
        when(aliases.findPrimaryByAliasGuid(SCHEDULER)).thenReturn(Optional.of(alias));

        when(members.findActiveMembers(10L)).thenReturn(List.of(member(500L, 501L), member(600L, 601L)));
    }

    private static GroupMember member(Long personId, Long aliasId) {
        GroupMember m = new GroupMember();
        m.setGroupId(10L);
        m.setPersonId(personId);
        m.setPersonAliasId(aliasId);
        m.setActive(true);
        return m;
    }

    private AutoScheduleService service(AttendanceAutoAssigner assigner, int chunkSize) {
        return new AutoScheduleService(
                new EligibleGroupResolver(catalog),
                new SchedulerIdentityResolver(aliases),
                new DateWindowGenerator(DayOfWeek.SUNDAY),
                new ScheduleLocationMatcher(catalog),
                new OccurrenceMaterializer(occurrences, false),
                new BatchAssigner(assigner, transactions, chunkSize),
                new ConfirmationSweeper(attendances, transactions),
                CLOCK);
    }

    private AutoScheduleService defaultService() {
        return service(new GroupMemberAutoAssigner(occurrences, members, attendances), 10_000);
    }

    @Test
    void twoWeeks_createsTwoOccurrences_assignsAndConfirms() {
        AutoScheduleResult result = defaultService().run(new AutoScheduleCommand(GROUP_TYPE, SCHEDULER, 2, null));

        assertThat(result.aborted()).isFalse();
        assertThat(result.hasErrors()).isFalse();
        assertThat(result.occurrenceCount()).isEqualTo(2);
        assertThat(result.assignedCount()).isEqualTo(2);
        assertThat(result.chunkCount()).isEqualTo(1);
        assertThat(result.attendancesCreated()).isEqualTo(4);
        assertThat(result.confirmedCount()).isEqualTo(4);
        assertThat(occurrences.all()).extracting(o -> o.getOccurrenceDate())
                .containsExactly(LocalDate.of(2026, 10, 18), LocalDate.of(2026, 10, 25));
        assertThat(attendances.all()).allSatisfy(a -> {
            assertThat(a.getRsvp()).isEqualTo(RsvpStatus.YES);
            assertThat(a.getScheduledByPersonAliasId()).isEqualTo(901L);
        });
    }

    @Test
    void rerun_isIdempotent() {
        AutoScheduleService service = defaultService();
        AutoScheduleCommand command = new AutoScheduleCommand(GROUP_TYPE, SCHEDULER, 2, null);

        service.run(command);
        AutoScheduleResult second = service.run(command);

        assertThat(second.occurrenceCount()).isEqualTo(2);
        assertThat(second.attendancesCreated()).isZero();
        assertThat(second.confirmedCount()).isZero();
        assertThat(occurrences.all()).hasSize(2);
        assertThat(attendances.all()).hasSize(4);
    }

    @Test
    void unknownGroupTypeAndScheduler_bothReported_andNothingTouched() {
        UUID unknownType = UUID.randomUUID();
        UUID unknownScheduler = UUID.randomUUID();

        AutoScheduleResult result = defaultService().run(new AutoScheduleCommand(unknownType, unknownScheduler, 2, null));

        assertThat(result.aborted()).isTrue();
        assertThat(result.errorMessages()).containsExactly(
                "No group type was provided",
                "Person could not be found for selected value ('" + unknownScheduler + "')!");
        assertThat(occurrences.getOrAddCalls).isZero();
        assertThat(transactions.commits).isZero();
    }

    @Test
    void negativeWeeks_abortsRun() {
        AutoScheduleResult result = defaultService().run(new AutoScheduleCommand(GROUP_TYPE, SCHEDULER, -1, null));

        assertThat(result.aborted()).isTrue();
        assertThat(result.errorMessages()).hasSize(1);
        assertThat(occurrences.getOrAddCalls).isZero();
    }

    @Test
    void failedChunk_stillRunsConfirmationOverAllOccurrences() {
        // 3週目のオカレンスを先に作っておき、未確定の出欠を登録
        Long lastWeek = occurrences.getOrAdd(new OccurrenceKey(LocalDate.of(2026, 11, 1), 10L, 200L, 1L)).getId();
        Attendance pending = attendances.add(lastWeek, 701L, RsvpStatus.MAYBE, true, null);
        int[] calls = {0};
        AttendanceAutoAssigner failingSecondChunk = (chunk, scheduler) -> {
            if (++calls[0] == 2) throw new IllegalStateException("deadlock detected");
            return 0;
        };

        AutoScheduleResult result = service(failingSecondChunk, 1).run(new AutoScheduleCommand(GROUP_TYPE, SCHEDULER, 3, null));

        assertThat(result.aborted()).isFalse();
        assertThat(result.occurrenceCount()).isEqualTo(3);
        assertThat(result.chunkCount()).isEqualTo(2);
        assertThat(result.assignedCount()).isEqualTo(1);
        assertThat(result.errorMessages()).containsExactly("Auto-assignment failed in chunk 2: deadlock detected");
        assertThat(calls[0]).isEqualTo(2);
        assertThat(result.confirmedCount()).isEqualTo(1);
        assertThat(pending.getRsvp()).isEqualTo(RsvpStatus.YES);
    }

    @Test
    void malformedSchedule_isReported_whileValidScheduleIsStillScheduled() {
        when(catalog.findSchedules(any())).thenReturn(List.of(
                CatalogFixtures.weekly(1, DayOfWeek.SUNDAY, LocalTime.of(9, 0)),
                CatalogFixtures.cron(6, "not a cron")));

        AutoScheduleResult result = defaultService().run(new AutoScheduleCommand(GROUP_TYPE, SCHEDULER, 2, null));

        assertThat(result.aborted()).isFalse();
        assertThat(result.occurrenceCount()).isEqualTo(2);
        assertThat(result.attendancesCreated()).isEqualTo(4);
        assertThat(result.confirmedCount()).isEqualTo(4);
        assertThat(result.errorMessages()).singleElement()
                .satisfies(m -> assertThat(m).startsWith("Schedule 6 ('Cron 6') skipped:"));
    }

    @Test
    void attributeKey_filtersGroups() {
        when(catalog.findGroupAttributeValue(any(), any())).thenReturn(Optional.of("False"));

        AutoScheduleResult result = defaultService().run(new AutoScheduleCommand(GROUP_TYPE, SCHEDULER, 2, "AutoSchedule"));

        assertThat(result.hasErrors()).isFalse();
        assertThat(result.occurrenceCount()).isZero();
        assertThat(occurrences.getOrAddCalls).isZero();
    }
}
