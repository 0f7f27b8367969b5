package io.github.riemr.autoschedule.application.assign;

import io.github.riemr.autoschedule.application.repository.AttendanceOccurrenceRepository;
import io.github.riemr.autoschedule.application.repository.AttendanceRepository;
import io.github.riemr.autoschedule.application.repository.GroupMemberRepository;
import io.github.riemr.autoschedule.domain.model.RsvpStatus;
import io.github.riemr.autoschedule.domain.model.SchedulerIdentity;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Attendance;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.AttendanceOccurrence;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupMember;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Requests every active member of an occurrence's group whose preferred schedule and location
 * (when set) match. A person is requested at most once per date and schedule; occurrences
 * earlier in the list take precedence.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroupMemberAutoAssigner implements AttendanceAutoAssigner {
    private final AttendanceOccurrenceRepository occurrenceRepository;
    private final GroupMemberRepository memberRepository;
    private final AttendanceRepository attendanceRepository;

    @Override
    public int assign(List<Long> occurrenceIds, SchedulerIdentity scheduler) {
        Map<Long, AttendanceOccurrence> occurrences = occurrenceRepository.findByIds(occurrenceIds).stream()
                .collect(Collectors.toMap(AttendanceOccurrence::getId, Function.identity()));
        Map<Long, List<GroupMember>> membersByGroup = new HashMap<>();

        int created = 0;
        for (Long occurrenceId : occurrenceIds) {
            AttendanceOccurrence occurrence = occurrences.get(occurrenceId);
            if (occurrence == null) {
                log.warn("Occurrence {} disappeared before assignment", occurrenceId);
                continue;
            }
            List<GroupMember> members = membersByGroup.computeIfAbsent(occurrence.getGroupId(), memberRepository::findActiveMembers);
            for (GroupMember member : members) {
                if (!prefers(member, occurrence)) continue;
                if (attendanceRepository.isRequestedOn(member.getPersonId(), occurrence.getOccurrenceDate(), occurrence.getScheduleId())) continue;
                if (attendanceRepository.addIfAbsent(newRequest(occurrence, member, scheduler))) created++;
            }
        }
        log.debug("Assigned {} attendances over {} occurrences", created, occurrenceIds.size());
        return created;
    }

    static boolean prefers(GroupMember member, AttendanceOccurrence occurrence) {
        return (member.getPreferredScheduleId() == null || member.getPreferredScheduleId().equals(occurrence.getScheduleId()))
                && (member.getPreferredLocationId() == null || member.getPreferredLocationId().equals(occurrence.getLocationId()));
    }

    private static Attendance newRequest(AttendanceOccurrence occurrence, GroupMember member, SchedulerIdentity scheduler) {
        Attendance a = new Attendance();
        a.setOccurrenceId(occurrence.getId());
        a.setPersonAliasId(member.getPersonAliasId());
        a.setRsvp(RsvpStatus.UNKNOWN);
        a.setRequestedToAttend(true);
        a.setScheduledToAttend(false);
        a.setScheduledByPersonAliasId(scheduler.personAliasId());
        return a;
    }
}
