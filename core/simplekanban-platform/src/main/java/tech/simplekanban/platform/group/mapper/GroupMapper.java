package tech.simplekanban.platform.group.mapper;

import tech.simplekanban.platform.group.Group;
import tech.simplekanban.platform.group.GroupMembership;
import tech.simplekanban.platform.group.entity.GroupEntity;
import tech.simplekanban.platform.group.entity.GroupMembershipEntity;

/**
 * Mapper for groups and their memberships.
 */
public final class GroupMapper {

    private GroupMapper() {
    }

    public static Group toDomain(GroupEntity entity) {
        if (entity == null) {
            return null;
        }

        Group group = new Group();
        group.id = entity.id;
        group.name = entity.name;
        group.description = entity.description;
        group.createdAt = entity.createdAt;
        group.updatedAt = entity.updatedAt;
        return group;
    }

    public static GroupEntity toEntity(Group group) {
        if (group == null) {
            return null;
        }

        GroupEntity entity = new GroupEntity();
        entity.id = group.id;
        entity.createdAt = group.createdAt;
        updateEntity(entity, group);
        return entity;
    }

    public static void updateEntity(GroupEntity entity, Group group) {
        entity.name = group.name;
        entity.description = group.description;
        entity.updatedAt = group.updatedAt;
    }

    public static GroupMembership toDomain(GroupMembershipEntity entity) {
        if (entity == null) {
            return null;
        }

        GroupMembership membership = new GroupMembership();
        membership.id = entity.id;
        membership.groupId = entity.groupId;
        membership.userId = entity.userId;
        membership.role = entity.role;
        membership.createdAt = entity.createdAt;
        return membership;
    }

    public static GroupMembershipEntity toEntity(GroupMembership membership) {
        if (membership == null) {
            return null;
        }

        GroupMembershipEntity entity = new GroupMembershipEntity();
        entity.id = membership.id;
        entity.groupId = membership.groupId;
        entity.userId = membership.userId;
        entity.role = membership.role;
        entity.createdAt = membership.createdAt;
        return entity;
    }
}
