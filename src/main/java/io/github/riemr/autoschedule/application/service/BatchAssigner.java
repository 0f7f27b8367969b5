package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.application.assign.AttendanceAutoAssigner;
import io.github.riemr.autoschedule.application.dto.AssignmentBatchResult;
import io.github.riemr.autoschedule.application.exception.AssignmentBatchException;
import io.github.riemr.autoschedule.domain.model.SchedulerIdentity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.ArrayList;
import java.util.List;

/**
 * Feeds occurrence ids to the assignment engine in fixed-size chunks, one commit per chunk.
 * The first failing chunk stops the loop; chunks committed before it stay committed.
 */
@Component
@Slf4j
public class BatchAssigner {
    private final AttendanceAutoAssigner autoAssigner;
    private final TransactionOperations transactions;
    private final int chunkSize;

    public BatchAssigner(AttendanceAutoAssigner autoAssigner,
                         TransactionOperations transactions,
                         @Value("${autoschedule.assignment.chunk-size:10000}") int chunkSize) {
        if (chunkSize < 1) throw new IllegalArgumentException("chunk size must be >= 1");
        this.autoAssigner = autoAssigner;
        this.transactions = transactions;
        this.chunkSize = chunkSize;
    }

    public AssignmentBatchResult assign(List<Long> occurrenceIds, SchedulerIdentity scheduler) {
        int chunks = 0;
        int assigned = 0;
        int attendances = 0;
        String error = null;
        try {
            for (List<Long> chunk : partition(occurrenceIds, chunkSize)) {
                chunks++;
                Integer created = transactions.execute(status -> autoAssigner.assign(chunk, scheduler));
                assigned += chunk.size();
                attendances += created == null ? 0 : created;
                log.debug("Chunk {} committed: {} occurrences, {} attendances", chunks, chunk.size(), created);
            }
        } catch (RuntimeException e) {
            AssignmentBatchException failure = new AssignmentBatchException(chunks, e);
            log.error("{} ({} of {} occurrences committed)", failure.getMessage(), assigned, occurrenceIds.size(), e);
            error = failure.getMessage();
        }
        return new AssignmentBatchResult(occurrenceIds.size(), chunks, assigned, attendances, error);
    }

    /** Consecutive slices of at most {@code size} elements, in original order. */
    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>(items.size() / size + 1);
        int from = 0;
        while (from < items.size()) {
            int to = (int) Math.min((long) from + size, items.size());
            chunks.add(List.copyOf(items.subList(from, to)));
            from = to;
        }
        return chunks;
    }
}
