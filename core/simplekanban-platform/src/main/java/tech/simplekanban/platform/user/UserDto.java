package tech.simplekanban.platform.user;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;

@Schema(description = "User account, without credentials")
public record UserDto(
    @Schema(description = "User ID", example = "usr_0ABC123DEF456")
    String id,
    String username,
    String email,
    String fullName,
    boolean active,
    boolean admin,
    Instant createdAt
) {

    public static UserDto from(User user) {
        return new UserDto(user.id, user.username, user.email, user.fullName, user.active, user.admin, user.createdAt);
    }
}
