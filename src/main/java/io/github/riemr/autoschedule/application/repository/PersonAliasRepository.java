package io.github.riemr.autoschedule.application.repository;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.PersonAlias;

import java.util.Optional;
import java.util.UUID;

public interface PersonAliasRepository {
    Optional<PersonAlias> findPrimaryByAliasGuid(UUID aliasGuid);
}
