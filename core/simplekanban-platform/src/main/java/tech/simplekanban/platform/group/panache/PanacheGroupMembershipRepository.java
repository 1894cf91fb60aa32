package tech.simplekanban.platform.group.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.LockModeType;
import jakarta.transaction.Transactional;
import tech.simplekanban.platform.group.GroupMembership;
import tech.simplekanban.platform.group.GroupMembershipRepository;
import tech.simplekanban.platform.group.GroupRole;
import tech.simplekanban.platform.group.entity.GroupMembershipEntity;
import tech.simplekanban.platform.group.mapper.GroupMapper;

import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of GroupMembershipRepository.
 */
@ApplicationScoped
@Transactional
public class PanacheGroupMembershipRepository
        implements GroupMembershipRepository, PanacheRepositoryBase<GroupMembershipEntity, String> {

    @Override
    public Optional<GroupMembership> findMembership(String groupId, String userId) {
        return find("groupId = ?1 AND userId = ?2", groupId, userId)
            .firstResultOptional()
            .map(GroupMapper::toDomain);
    }

    @Override
    public List<GroupMembership> findByGroupId(String groupId) {
        return list("groupId = ?1 ORDER BY createdAt", groupId).stream()
            .map(GroupMapper::toDomain)
            .toList();
    }

    @Override
    public List<GroupMembership> lockOwners(String groupId) {
        return find("groupId = ?1 AND role = ?2", groupId, GroupRole.OWNER)
            .withLock(LockModeType.PESSIMISTIC_WRITE)
            .list()
            .stream()
            .map(GroupMapper::toDomain)
            .toList();
    }

    @Override
    public void insert(GroupMembership membership) {
        persist(GroupMapper.toEntity(membership));
    }

    @Override
    public void save(GroupMembership membership) {
        find("groupId = ?1 AND userId = ?2", membership.groupId, membership.userId)
            .firstResultOptional()
            .ifPresent(entity -> entity.role = membership.role);
    }

    @Override
    public boolean deleteMembership(String groupId, String userId) {
        return delete("groupId = ?1 AND userId = ?2", groupId, userId) > 0;
    }
}
