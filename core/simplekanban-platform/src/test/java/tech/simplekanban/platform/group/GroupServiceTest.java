package tech.simplekanban.platform.group;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.simplekanban.platform.board.BoardRepository;
import tech.simplekanban.platform.common.Result;
import tech.simplekanban.platform.common.errors.UseCaseError;
import tech.simplekanban.platform.testing.Fixtures;
import tech.simplekanban.platform.user.UserRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GroupServiceTest {

    private static final String GROUP_ID = "grp_0HZGROUP0001";

    @Mock
    GroupRepository groupRepository;

    @Mock
    GroupMembershipRepository membershipRepository;

    @Mock
    BoardRepository boardRepository;

    @Mock
    UserRepository userRepository;

    @InjectMocks
    GroupService service;

    @BeforeEach
    void setUp() {
        service.clock = Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC);
    }

    // ========================================
    // create / delete TESTS
    // ========================================

    @Test
    @DisplayName("create should make the creator the first owner")
    void create_shouldAddCreatorAsOwner() {
        // Arrange
        ArgumentCaptor<GroupMembership> captor = ArgumentCaptor.forClass(GroupMembership.class);

        // Act
        Result<Group> result = service.create("usr_1", " Platform team ", null);

        // Assert
        Group group = ((Result.Success<Group>) result).value();
        assertThat(group.name).isEqualTo("Platform team");
        verify(groupRepository).insert(group);
        verify(membershipRepository).insert(captor.capture());
        assertThat(captor.getValue().userId).isEqualTo("usr_1");
        assertThat(captor.getValue().groupId).isEqualTo(group.id);
        assertThat(captor.getValue().role).isEqualTo(GroupRole.OWNER);
    }

    @Test
    @DisplayName("delete should unlink the group's boards instead of deleting them")
    void delete_shouldOrphanBoards() {
        // Arrange
        when(groupRepository.findGroupById(GROUP_ID)).thenReturn(Optional.of(new Group()));
        when(boardRepository.unlinkGroup(GROUP_ID)).thenReturn(2);

        // Act
        Result<String> result = service.delete(GROUP_ID);

        // Assert
        assertThat(result.isSuccess()).isTrue();
        verify(boardRepository).unlinkGroup(GROUP_ID);
        verify(groupRepository).deleteGroup(GROUP_ID);
    }

    // ========================================
    // membership TESTS
    // ========================================

    @Test
    @DisplayName("addMember should default to the member role and reject duplicates")
    void addMember_shouldDefaultRole_andRejectDuplicates() {
        // Arrange
        when(groupRepository.findGroupById(GROUP_ID)).thenReturn(Optional.of(new Group()));
        when(userRepository.findByIdOptional("usr_2")).thenReturn(Optional.of(Fixtures.user("usr_2", true, false)));
        when(membershipRepository.findMembership(GROUP_ID, "usr_2"))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(membership("usr_2", GroupRole.MEMBER)));

        // Act
        Result<GroupMembership> first = service.addMember(GROUP_ID, "usr_2", null);
        Result<GroupMembership> second = service.addMember(GROUP_ID, "usr_2", GroupRole.ADMIN);

        // Assert
        assertThat(((Result.Success<GroupMembership>) first).value().role).isEqualTo(GroupRole.MEMBER);
        assertThat(((Result.Failure<GroupMembership>) second).error().code()).isEqualTo("ALREADY_MEMBER");
        verify(membershipRepository, times(1)).insert(any());
    }

    @Test
    @DisplayName("removeMember should refuse to remove the last owner")
    void removeMember_shouldFail_whenLastOwner() {
        // Arrange
        GroupMembership owner = membership("usr_1", GroupRole.OWNER);
        when(membershipRepository.findMembership(GROUP_ID, "usr_1")).thenReturn(Optional.of(owner));
        when(membershipRepository.lockOwners(GROUP_ID)).thenReturn(List.of(owner));

        // Act
        Result<String> result = service.removeMember(GROUP_ID, "usr_1");

        // Assert
        UseCaseError error = ((Result.Failure<String>) result).error();
        assertThat(error).isInstanceOf(UseCaseError.BusinessRuleViolation.class);
        assertThat(error.code()).isEqualTo("LAST_OWNER");
        verify(membershipRepository, never()).deleteMembership(anyString(), anyString());
    }

    @Test
    @DisplayName("removeMember should remove an owner while another owner remains")
    void removeMember_shouldSucceed_whenOtherOwnerExists() {
        GroupMembership owner = membership("usr_1", GroupRole.OWNER);
        when(membershipRepository.findMembership(GROUP_ID, "usr_1")).thenReturn(Optional.of(owner));
        when(membershipRepository.lockOwners(GROUP_ID)).thenReturn(List.of(owner, membership("usr_3", GroupRole.OWNER)));

        assertThat(service.removeMember(GROUP_ID, "usr_1").isSuccess()).isTrue();
        verify(membershipRepository).deleteMembership(GROUP_ID, "usr_1");
    }

    @Test
    @DisplayName("removeMember should not lock owners when removing a plain member")
    void removeMember_shouldSkipOwnerCheck_forMembers() {
        when(membershipRepository.findMembership(GROUP_ID, "usr_2"))
            .thenReturn(Optional.of(membership("usr_2", GroupRole.MEMBER)));

        assertThat(service.removeMember(GROUP_ID, "usr_2").isSuccess()).isTrue();
        verify(membershipRepository, never()).lockOwners(anyString());
    }

    @Test
    @DisplayName("changeRole should refuse to demote the last owner")
    void changeRole_shouldFail_whenDemotingLastOwner() {
        // Arrange
        GroupMembership owner = membership("usr_1", GroupRole.OWNER);
        when(membershipRepository.findMembership(GROUP_ID, "usr_1")).thenReturn(Optional.of(owner));
        when(membershipRepository.lockOwners(GROUP_ID)).thenReturn(List.of(owner));

        // Act
        Result<GroupMembership> result = service.changeRole(GROUP_ID, "usr_1", GroupRole.ADMIN);

        // Assert
        assertThat(((Result.Failure<GroupMembership>) result).error().code()).isEqualTo("LAST_OWNER");
        assertThat(owner.role).isEqualTo(GroupRole.OWNER);
    }

    @Test
    @DisplayName("changeRole should promote a member to owner")
    void changeRole_shouldPromote_whenTargetIsMember() {
        GroupMembership member = membership("usr_2", GroupRole.MEMBER);
        when(membershipRepository.findMembership(GROUP_ID, "usr_2")).thenReturn(Optional.of(member));

        Result<GroupMembership> result = service.changeRole(GROUP_ID, "usr_2", GroupRole.OWNER);

        assertThat(((Result.Success<GroupMembership>) result).value().role).isEqualTo(GroupRole.OWNER);
        verify(membershipRepository).save(member);
    }

    @Test
    @DisplayName("changeRole should fail when the user is not a member")
    void changeRole_shouldFail_whenMembershipMissing() {
        when(membershipRepository.findMembership(GROUP_ID, "usr_9")).thenReturn(Optional.empty());

        Result<GroupMembership> result = service.changeRole(GROUP_ID, "usr_9", GroupRole.MEMBER);

        assertThat(((Result.Failure<GroupMembership>) result).error()).isInstanceOf(UseCaseError.NotFoundError.class);
    }

    private static GroupMembership membership(String userId, GroupRole role) {
        GroupMembership membership = new GroupMembership();
        membership.id = "gmb_" + userId;
        membership.groupId = GROUP_ID;
        membership.userId = userId;
        membership.role = role;
        return membership;
    }
}
