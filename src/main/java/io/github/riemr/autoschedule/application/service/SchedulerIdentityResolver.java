package io.github.riemr.autoschedule.application.service;

import io.github.riemr.autoschedule.application.exception.AutoScheduleConfigurationException;
import io.github.riemr.autoschedule.application.repository.PersonAliasRepository;
import io.github.riemr.autoschedule.domain.model.SchedulerIdentity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
@RequiredArgsConstructor
public class SchedulerIdentityResolver {
    private final PersonAliasRepository personAliasRepository;

    /**
     * Resolves any alias of the scheduling person to that person's primary alias.
     */
    public SchedulerIdentity resolve(UUID aliasGuid) {
        return personAliasRepository.findPrimaryByAliasGuid(aliasGuid)
                .map(alias -> new SchedulerIdentity(alias.getPersonId(), alias.getId()))
                .orElseThrow(() -> new AutoScheduleConfigurationException(
                        String.format("Person could not be found for selected value ('%s')!", aliasGuid)));
    }
}
