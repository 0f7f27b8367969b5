package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.application.dto.AssignmentBatchResult;
import io.github.riemr.autoschedule.application.dto.AutoScheduleCommand;
import io.github.riemr.autoschedule.application.dto.AutoScheduleResult;
import io.github.riemr.autoschedule.application.dto.ConfirmationSweepResult;
import io.github.riemr.autoschedule.application.dto.MaterializationResult;
import io.github.riemr.autoschedule.application.dto.ScheduleLocationMatch;
import io.github.riemr.autoschedule.application.exception.AutoScheduleException;
import io.github.riemr.autoschedule.domain.model.SchedulerIdentity;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.Group;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * グループタイプ単位の自動スケジューリングを実行するサービス。
 * <ul>
 *   <li>対象グループ・スケジューラ (担当者) を解決。失敗時はオカレンスに触れずに終了</li>
 *   <li>週ごとのオカレンスを get-or-add で生成</li>
 *   <li>チャンク単位で自動割当し、最後に未確定の出欠を確定</li>
 * </ul>
 * Errors from every stage are collected into the result; {@link #run} never throws.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AutoScheduleService {

    private final EligibleGroupResolver groupResolver;
    private final SchedulerIdentityResolver schedulerResolver;
    private final DateWindowGenerator dateWindowGenerator;
    private final ScheduleLocationMatcher scheduleLocationMatcher;
    private final OccurrenceMaterializer occurrenceMaterializer;
    private final BatchAssigner batchAssigner;
    private final ConfirmationSweeper confirmationSweeper;
    private final Clock clock;

    public AutoScheduleResult run(AutoScheduleCommand command) {
        List<String> errors = new ArrayList<>();

        // 1. 設定の解決 (両方チェックしてからまとめて報告)
        if (command.weeksOut() < 0) {
            errors.add("Number of weeks must not be negative: " + command.weeksOut());
        }
        List<Group> groups = List.of();
        try {
            groups = groupResolver.resolve(command.groupTypeGuid(), command.autoScheduleAttributeKey());
        } catch (RuntimeException e) {
            errors.add(describe("Group resolution failed", e));
        }
        SchedulerIdentity scheduler = null;
        try {
            scheduler = schedulerResolver.resolve(command.schedulerAliasGuid());
        } catch (RuntimeException e) {
            errors.add(describe("Scheduler lookup failed", e));
        }
        if (!errors.isEmpty()) {
            errors.forEach(m -> log.warn("Auto-schedule aborted: {}", m));
            return AutoScheduleResult.abortedWith(errors);
        }

        // 2. オカレンス生成
        List<Long> occurrenceIds;
        try {
            List<LocalDate> anchors = dateWindowGenerator.anchorDates(command.weeksOut(), LocalDate.now(clock));
            ScheduleLocationMatch match = scheduleLocationMatcher.match(groups);
            log.debug("{} groups, {} group locations, {} schedules, {} weeks",
                    groups.size(), match.groupLocations().size(), match.schedules().size(), anchors.size());
            MaterializationResult materialized = occurrenceMaterializer.materialize(anchors, match);
            occurrenceIds = materialized.occurrenceIds();
            errors.addAll(materialized.errorMessages());
        } catch (RuntimeException e) {
            log.error("Occurrence materialization failed", e);
            errors.add(describe("Occurrence materialization failed", e));
            return new AutoScheduleResult(false, 0, 0, 0, 0, 0, List.copyOf(errors));
        }

        // 3. 割当と確定は互いに独立して必ず両方実行
        AssignmentBatchResult assignment = batchAssigner.assign(occurrenceIds, scheduler);
        if (!assignment.succeeded()) errors.add(assignment.errorMessage());

        ConfirmationSweepResult sweep = confirmationSweeper.sweep(occurrenceIds);
        if (!sweep.succeeded()) errors.add(sweep.errorMessage());

        log.info("{} occurrences identified and {} occurrences scheduled in {} scheduling loops.",
                occurrenceIds.size(), assignment.occurrencesAssigned(), assignment.chunksProcessed());
        errors.forEach(m -> log.warn("Auto-schedule error: {}", m));

        return new AutoScheduleResult(false,
                occurrenceIds.size(),
                assignment.occurrencesAssigned(),
                assignment.chunksProcessed(),
                assignment.attendancesCreated(),
                sweep.confirmed(),
                List.copyOf(errors));
    }

    private static String describe(String stage, RuntimeException e) {
        if (e instanceof AutoScheduleException) return e.getMessage();
        log.error(stage, e);
        return stage + ": " + e.getMessage();
    }
}
