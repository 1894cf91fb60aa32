package tech.simplekanban.platform.apikey;

/**
 * A newly created key and its plaintext secret. The plaintext exists only in this object.
 */
public record IssuedApiKey(ApiKey apiKey, String plaintext) {

    @Override
    public String toString() {
        return "IssuedApiKey[id=" + apiKey.id + ", prefix=" + apiKey.keyPrefix + "]";
    }
}
