package tech.simplekanban.platform.group.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import tech.simplekanban.platform.group.Group;
import tech.simplekanban.platform.group.GroupRepository;
import tech.simplekanban.platform.group.entity.GroupEntity;
import tech.simplekanban.platform.group.mapper.GroupMapper;

import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of GroupRepository.
 */
@ApplicationScoped
@Transactional
public class PanacheGroupRepository implements GroupRepository, PanacheRepositoryBase<GroupEntity, String> {

    @Inject
    EntityManager em;

    @Override
    public Optional<Group> findGroupById(String id) {
        return Optional.ofNullable(GroupMapper.toDomain(findById(id)));
    }

    @Override
    public List<Group> findByMemberUserId(String userId) {
        return em.createQuery(
                "SELECT g FROM GroupEntity g, GroupMembershipEntity m " +
                "WHERE m.groupId = g.id AND m.userId = :userId ORDER BY g.name", GroupEntity.class)
            .setParameter("userId", userId)
            .getResultList()
            .stream()
            .map(GroupMapper::toDomain)
            .toList();
    }

    @Override
    public void insert(Group group) {
        persist(GroupMapper.toEntity(group));
    }

    @Override
    public void save(Group group) {
        GroupEntity entity = findById(group.id);
        if (entity != null) {
            GroupMapper.updateEntity(entity, group);
        }
    }

    @Override
    public boolean deleteGroup(String id) {
        em.createQuery("DELETE FROM GroupMembershipEntity WHERE groupId = :id")
            .setParameter("id", id)
            .executeUpdate();
        return deleteById(id);
    }
}
