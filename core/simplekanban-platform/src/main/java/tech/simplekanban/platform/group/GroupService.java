package tech.simplekanban.platform.group;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import tech.simplekanban.platform.board.BoardRepository;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.errors.UseCaseError;
import tech.simplekanban.platform.shared.EntityType;
import tech.simplekanban.platform.shared.TsidGenerator;
import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Group and membership management.
 *
 * <p>A group always keeps at least one owner: removing or demoting the last owner is
 * rejected. Owner rows are locked for the duration of the check so two concurrent
 * removals cannot both pass it.
 */
@ApplicationScoped
public class GroupService {

    private static final Logger LOG = Logger.getLogger(GroupService.class);
    private static final int MAX_NAME_LENGTH = 100;

    @Inject
    GroupRepository groupRepository;

    @Inject
    GroupMembershipRepository membershipRepository;

    @Inject
    BoardRepository boardRepository;

    @Inject
    UserRepository userRepository;

    @Inject
    Clock clock;

    /**
     * Create a group. The creator becomes its first owner.
     */
    @Transactional
    public Result<Group> create(String creatorUserId, String name, String description) {
        if (name == null || name.isBlank() || name.length() > MAX_NAME_LENGTH) {
            return Result.failure(new UseCaseError.ValidationError("INVALID_NAME",
                "Name is required and must be at most " + MAX_NAME_LENGTH + " characters"));
        }

        Instant now = clock.instant();
        Group group = new Group();
        group.id = TsidGenerator.generate(EntityType.GROUP);
        group.name = name.trim();
        group.description = description;
        group.createdAt = now;
        group.updatedAt = now;
        groupRepository.insert(group);

        membershipRepository.insert(newMembership(group.id, creatorUserId, GroupRole.OWNER, now));
        LOG.infof("Created group %s owned by %s", group.id, creatorUserId);
        return Result.success(group);
    }

    public Optional<Group> findById(String groupId) {
        return groupRepository.findGroupById(groupId);
    }

    public List<Group> listForUser(String userId) {
        return groupRepository.findByMemberUserId(userId);
    }

    public List<GroupMembership> listMembers(String groupId) {
        return membershipRepository.findByGroupId(groupId);
    }

    @Transactional
    public Result<Group> update(String groupId, String name, String description) {
        Optional<Group> found = groupRepository.findGroupById(groupId);
        if (found.isEmpty()) {
            return Result.failure(groupNotFound(groupId));
        }

        Group group = found.get();
        if (name != null) {
            if (name.isBlank() || name.length() > MAX_NAME_LENGTH) {
                return Result.failure(new UseCaseError.ValidationError("INVALID_NAME",
                    "Name must be between 1 and " + MAX_NAME_LENGTH + " characters"));
            }
            group.name = name.trim();
        }
        if (description != null) {
            group.description = description;
        }
        group.updatedAt = clock.instant();
        groupRepository.save(group);
        return Result.success(group);
    }

    /**
     * Delete a group and its memberships. Its boards are unlinked, not deleted, and become
     * reachable by administrators only.
     */
    @Transactional
    public Result<String> delete(String groupId) {
        if (groupRepository.findGroupById(groupId).isEmpty()) {
            return Result.failure(groupNotFound(groupId));
        }

        int orphaned = boardRepository.unlinkGroup(groupId);
        groupRepository.deleteGroup(groupId);
        LOG.infof("Deleted group %s, %d board(s) unlinked", groupId, orphaned);
        return Result.success(groupId);
    }

    @Transactional
    public Result<GroupMembership> addMember(String groupId, String userId, GroupRole role) {
        if (groupRepository.findGroupById(groupId).isEmpty()) {
            return Result.failure(groupNotFound(groupId));
        }
        Optional<User> user = userRepository.findByIdOptional(userId);
        if (user.isEmpty()) {
            return Result.failure(new UseCaseError.NotFoundError("USER_NOT_FOUND", "User not found",
                Map.of("userId", userId)));
        }
        if (membershipRepository.findMembership(groupId, userId).isPresent()) {
            return Result.failure(new UseCaseError.BusinessRuleViolation("ALREADY_MEMBER",
                "User is already a member of this group"));
        }

        GroupMembership membership = newMembership(groupId, userId, role == null ? GroupRole.MEMBER : role,
            clock.instant());
        membershipRepository.insert(membership);
        LOG.infof("Added user %s to group %s as %s", userId, groupId, membership.role);
        return Result.success(membership);
    }

    @Transactional
    public Result<GroupMembership> changeRole(String groupId, String userId, GroupRole role) {
        if (role == null) {
            return Result.failure(new UseCaseError.ValidationError("INVALID_ROLE", "Role is required"));
        }
        Optional<GroupMembership> found = membershipRepository.findMembership(groupId, userId);
        if (found.isEmpty()) {
            return Result.failure(membershipNotFound(groupId, userId));
        }

        GroupMembership membership = found.get();
        if (membership.role == GroupRole.OWNER && role != GroupRole.OWNER && isLastOwner(groupId)) {
            return Result.failure(lastOwner());
        }

        membership.role = role;
        membershipRepository.save(membership);
        LOG.infof("User %s is now %s of group %s", userId, role, groupId);
        return Result.success(membership);
    }

    @Transactional
    public Result<String> removeMember(String groupId, String userId) {
        Optional<GroupMembership> found = membershipRepository.findMembership(groupId, userId);
        if (found.isEmpty()) {
            return Result.failure(membershipNotFound(groupId, userId));
        }
        if (found.get().role == GroupRole.OWNER && isLastOwner(groupId)) {
            return Result.failure(lastOwner());
        }

        membershipRepository.deleteMembership(groupId, userId);
        LOG.infof("Removed user %s from group %s", userId, groupId);
        return Result.success(userId);
    }

    private boolean isLastOwner(String groupId) {
        return membershipRepository.lockOwners(groupId).size() <= 1;
    }

    private static GroupMembership newMembership(String groupId, String userId, GroupRole role, Instant now) {
        GroupMembership membership = new GroupMembership();
        membership.id = TsidGenerator.generate(EntityType.GROUP_MEMBERSHIP);
        membership.groupId = groupId;
        membership.userId = userId;
        membership.role = role;
        membership.createdAt = now;
        return membership;
    }

    private static UseCaseError groupNotFound(String groupId) {
        return new UseCaseError.NotFoundError("GROUP_NOT_FOUND", "Group not found", Map.of("groupId", groupId));
    }

    private static UseCaseError membershipNotFound(String groupId, String userId) {
        return new UseCaseError.NotFoundError("MEMBERSHIP_NOT_FOUND", "Membership not found",
            Map.of("groupId", groupId, "userId", userId));
    }

    private static UseCaseError lastOwner() {
        return new UseCaseError.BusinessRuleViolation("LAST_OWNER",
            "A group must keep at least one owner");
    }
}
