package tech.simplekanban.platform.group;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for groups.
 */
public interface GroupRepository {

    Optional<Group> findGroupById(String id);
    List<Group> findByMemberUserId(String userId);

    void insert(Group group);
    void save(Group group);

    /**
     * Delete the group and, with it, all of its memberships.
     */
    boolean deleteGroup(String id);
}
