package tech.simplekanban.platform.identity;

/**
 * Which kind of credential produced a {@link Principal}.
 */
public enum CredentialSource {
    SESSION,
    API_KEY
}
