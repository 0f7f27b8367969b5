package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.application.dto.ConfirmationSweepResult;
import io.github.riemr.autoschedule.application.exception.ConfirmationException;
import io.github.riemr.autoschedule.application.repository.AttendanceRepository;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Attendance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;

/**
 * Confirms requested attendances whose RSVP is still open on the occurrences of a run.
 * The whole sweep is one transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConfirmationSweeper {
    private final AttendanceRepository attendanceRepository;
    private final TransactionOperations transactions;

    public ConfirmationSweepResult sweep(List<Long> occurrenceIds) {
        try {
            Integer confirmed = transactions.execute(status -> {
                int count = 0;
                for (Long occurrenceId : occurrenceIds) {
                    for (Attendance attendance : attendanceRepository.findByOccurrenceId(occurrenceId)) {
                        if (!isAutoConfirmable(attendance)) continue;
                        attendanceRepository.confirmScheduled(attendance.getId());
                        count++;
                    }
                }
                return count;
            });
            int total = confirmed == null ? 0 : confirmed;
            log.debug("Confirmed {} attendances over {} occurrences", total, occurrenceIds.size());
            return new ConfirmationSweepResult(total, null);
        } catch (RuntimeException e) {
            ConfirmationException failure = new ConfirmationException(e);
            log.error(failure.getMessage(), e);
            return new ConfirmationSweepResult(0, failure.getMessage());
        }
    }

    /** Requested, not yet attended, and RSVP still MAYBE or UNKNOWN. */
    static boolean isAutoConfirmable(Attendance a) {
        return Boolean.TRUE.equals(a.getRequestedToAttend())
                && !Boolean.TRUE.equals(a.getDidAttend())
                && a.getRsvp() != null
                && a.getRsvp().isUndecided();
    }
}
