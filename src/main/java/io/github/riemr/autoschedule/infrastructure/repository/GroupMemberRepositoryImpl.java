package io.github.riemr.autoschedule.infrastructure.repository;

import io.github.riemr.autoschedule.application.repository.GroupMemberRepository;
import io.github.riemr.autoschedule.infrastructure.mapper.GroupMemberMapper;
import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupMember;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class GroupMemberRepositoryImpl implements GroupMemberRepository {
    private final GroupMemberMapper mapper;
    public GroupMemberRepositoryImpl(GroupMemberMapper mapper) { this.mapper = mapper; }
    @Override public List<GroupMember> findActiveMembers(Long groupId) { return mapper.selectActiveByGroupId(groupId); }
}
