package io.github.riemr.autoschedule.infrastructure.repository;

import io.github.riemr.autoschedule.application.repository.PersonAliasRepository;
import io.github.riemr.autoschedule.infrastructure.mapper.PersonAliasMapper;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.PersonAlias;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public class PersonAliasRepositoryImpl implements PersonAliasRepository {
    private final PersonAliasMapper mapper;
    public PersonAliasRepositoryImpl(PersonAliasMapper mapper) { this.mapper = mapper; }
    @Override public Optional<PersonAlias> findPrimaryByAliasGuid(UUID aliasGuid) {
        if (aliasGuid == null) return Optional.empty();
        return Optional.ofNullable(mapper.selectPrimaryByAliasGuid(aliasGuid.toString()));
    }
}
