package io.github.riemr.autoschedule.application.repository;

import io.github.riemr.autoschedule.infrastructure.persistence.entity.GroupMember;

import java.util.List;

public interface GroupMemberRepository {
    List<GroupMember> findActiveMembers(Long groupId);
}
