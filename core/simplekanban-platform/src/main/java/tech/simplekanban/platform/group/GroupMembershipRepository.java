package tech.simplekanban.platform.group;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for group memberships.
 */
public interface GroupMembershipRepository {

    Optional<GroupMembership> findMembership(String groupId, String userId);
    List<GroupMembership> findByGroupId(String groupId);

    /**
     * Lock the group's owner memberships for the rest of the transaction so concurrent
     * removals or demotions of the last owners serialize.
     */
    List<GroupMembership> lockOwners(String groupId);

    void insert(GroupMembership membership);
    void save(GroupMembership membership);
    boolean deleteMembership(String groupId, String userId);
}
