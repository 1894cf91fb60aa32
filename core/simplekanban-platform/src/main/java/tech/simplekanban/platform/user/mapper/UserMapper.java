package tech.simplekanban.platform.user.mapper;

import tech.simplekanban.platform.user.User;
import tech.simplekanban.platform.user.entity.UserEntity;

/**
 * Mapper for converting between the User domain model and its JPA entity.
 */
public final class UserMapper {

    private UserMapper() {
    }

    public static User toDomain(UserEntity entity) {
        if (entity == null) {
            return null;
        }

        User user = new User();
        user.id = entity.id;
        user.username = entity.username;
        user.email = entity.email;
        user.passwordHash = entity.passwordHash;
        user.fullName = entity.fullName;
        user.active = entity.active;
        user.admin = entity.admin;
        user.credentialsChangedAt = entity.credentialsChangedAt;
        user.createdAt = entity.createdAt;
        user.updatedAt = entity.updatedAt;
        return user;
    }

    public static UserEntity toEntity(User user) {
        if (user == null) {
            return null;
        }

        UserEntity entity = new UserEntity();
        entity.id = user.id;
        updateEntity(entity, user);
        entity.createdAt = user.createdAt;
        return entity;
    }

    /**
     * Update existing entity from domain model. The id and creation time never change.
     */
    public static void updateEntity(UserEntity entity, User user) {
        entity.username = user.username;
        entity.email = user.email;
        entity.passwordHash = user.passwordHash;
        entity.fullName = user.fullName;
        entity.active = user.active;
        entity.admin = user.admin;
        entity.credentialsChangedAt = user.credentialsChangedAt;
        entity.updatedAt = user.updatedAt;
    }
}
