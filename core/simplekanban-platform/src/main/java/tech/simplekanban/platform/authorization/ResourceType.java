package tech.simplekanban.platform.authorization;

/**
 * Kinds of resources the authorization engine can reason about.
 */
public enum ResourceType {
    BOARD,
    GROUP,
    API_KEY,
    USER,
    SYSTEM
}
