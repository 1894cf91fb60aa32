package tech.simplekanban.platform.authorization;

import tech.simplekanban.platform.apikey.ApiKeyScope;
import tech.simplekanban.platform.group.GroupRole;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Pure capability-set functions: role and scope mappings and their intersection.
 */
public final class Capabilities {

    public static final Set<Capability> NONE = Collections.unmodifiableSet(EnumSet.noneOf(Capability.class));
    public static final Set<Capability> ALL = Collections.unmodifiableSet(EnumSet.allOf(Capability.class));

    /** What the owner of a personal resource may do. */
    public static final Set<Capability> OWNER = Collections.unmodifiableSet(
        EnumSet.of(Capability.READ, Capability.WRITE, Capability.DELETE, Capability.MANAGE_MEMBERS));

    /** What any authenticated user may do on the system resource. */
    public static final Set<Capability> AUTHENTICATED = Collections.unmodifiableSet(EnumSet.of(Capability.VIEW_DOCS));

    private static final Set<Capability> CONTENT = Collections.unmodifiableSet(
        EnumSet.of(Capability.READ, Capability.WRITE));

    private Capabilities() {
    }

    /**
     * Capabilities a group role grants on boards the group owns.
     */
    public static Set<Capability> forBoardRole(GroupRole role) {
        if (role == null) {
            return NONE;
        }
        return switch (role) {
            case OWNER, ADMIN -> OWNER;
            case MEMBER -> CONTENT;
        };
    }

    /**
     * Capabilities a group role grants on the group itself. Only owners may delete a group.
     */
    public static Set<Capability> forGroupRole(GroupRole role) {
        if (role == null) {
            return NONE;
        }
        return switch (role) {
            case OWNER -> OWNER;
            case ADMIN -> Collections.unmodifiableSet(EnumSet.of(Capability.READ, Capability.WRITE, Capability.MANAGE_MEMBERS));
            case MEMBER -> Collections.unmodifiableSet(EnumSet.of(Capability.READ));
        };
    }

    public static Set<Capability> forScope(ApiKeyScope scope) {
        return switch (scope) {
            case READ -> Collections.unmodifiableSet(EnumSet.of(Capability.READ));
            case WRITE -> OWNER;
            case ADMIN -> ALL;
            case DOCS -> Collections.unmodifiableSet(EnumSet.of(Capability.VIEW_DOCS));
        };
    }

    /**
     * Union of the capabilities of the given scope values. Unknown values contribute nothing.
     */
    public static Set<Capability> forScopes(Collection<String> scopes) {
        EnumSet<Capability> result = EnumSet.noneOf(Capability.class);
        for (String value : scopes) {
            ApiKeyScope.fromValue(value).ifPresent(scope -> result.addAll(forScope(scope)));
        }
        return Collections.unmodifiableSet(result);
    }

    public static Set<Capability> intersect(Set<Capability> first, Set<Capability> second) {
        if (first.isEmpty() || second.isEmpty()) {
            return NONE;
        }
        EnumSet<Capability> result = EnumSet.copyOf(first);
        result.retainAll(second);
        return Collections.unmodifiableSet(result);
    }
}
