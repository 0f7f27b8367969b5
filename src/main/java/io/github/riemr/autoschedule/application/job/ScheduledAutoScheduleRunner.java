package io.github.riemr.autoschedule.application.job;

import io.github.riemr.autoschedule.application.dto.AutoScheduleCommand;
import io.github.riemr.autoschedule.application.dto.AutoScheduleResult;
import io.github.riemr.autoschedule.application.service.AutoScheduleService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Runs the auto-scheduler on a cron for every configured group type.
 * Disabled unless {@code autoschedule.job.cron} is set.
 */
@Component
@Slf4j
public class ScheduledAutoScheduleRunner {
    private final AutoScheduleService autoScheduleService;
    private final List<UUID> groupTypeGuids;
    private final String schedulerAliasGuid;
    private final int weeksOut;
    private final String attributeKey;

    public ScheduledAutoScheduleRunner(AutoScheduleService autoScheduleService,
                                       @Value("${autoschedule.job.group-type-guids:}") String[] groupTypeGuids,
                                       @Value("${autoschedule.job.scheduler-alias-guid:}") String schedulerAliasGuid,
                                       @Value("${autoschedule.default-weeks-out:7}") int weeksOut,
                                       @Value("${autoschedule.job.attribute-key:}") String attributeKey) {
        this.autoScheduleService = autoScheduleService;
        this.groupTypeGuids = Arrays.stream(groupTypeGuids)
                .filter(StringUtils::hasText)
                .map(g -> UUID.fromString(g.trim()))
                .toList();
        this.schedulerAliasGuid = schedulerAliasGuid;
        this.weeksOut = weeksOut;
        this.attributeKey = attributeKey;
    }

    @Scheduled(cron = "${autoschedule.job.cron:-}")
    public void runConfiguredGroupTypes() {
        if (!StringUtils.hasText(schedulerAliasGuid)) {
            log.warn("autoschedule.job.scheduler-alias-guid is not set; skipping scheduled run");
            return;
        }
        UUID scheduler = UUID.fromString(schedulerAliasGuid.trim());
        for (UUID groupTypeGuid : groupTypeGuids) {
            AutoScheduleResult result = autoScheduleService.run(
                    new AutoScheduleCommand(groupTypeGuid, scheduler, weeksOut, attributeKey));
            if (result.hasErrors()) {
                log.warn("Scheduled auto-schedule for group type {} finished with {} error(s)",
                        groupTypeGuid, result.errorMessages().size());
            }
        }
    }
}
