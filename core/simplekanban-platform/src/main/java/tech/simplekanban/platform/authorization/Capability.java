package tech.simplekanban.platform.authorization;

/**
 * Actions that can be authorized on a resource.
 */
public enum Capability {
    READ,
    WRITE,
    DELETE,
    MANAGE_MEMBERS,
    /** System administration: user management, orphaned boards. */
    ADMINISTER,
    VIEW_DOCS
}
