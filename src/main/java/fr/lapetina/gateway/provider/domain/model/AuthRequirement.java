package fr.lapetina.gateway.provider.domain.model;

/**
 * Credentials a client must present to receive a source's bundle.
 * Either part may be absent; when both are present, either one is sufficient.
 *
 * @param apiKey    expected {@code X-API-Key} value, or null
 * @param basicAuth expected basic-auth credentials, or null
 */
public record AuthRequirement(String apiKey, BasicAuth basicAuth) {

    public AuthRequirement {
        if (apiKey != null && apiKey.isEmpty()) {
            apiKey = null;
        }
    }

    public boolean hasApiKey() {
        return apiKey != null;
    }

    public boolean hasBasicAuth() {
        return basicAuth != null;
    }

    /**
     * True when nothing is required, i.e. every request is allowed.
     */
    public boolean isOpen() {
        return !hasApiKey() && !hasBasicAuth();
    }

    public static AuthRequirement none() {
        return new AuthRequirement(null, null);
    }

    public static AuthRequirement apiKey(String apiKey) {
        return new AuthRequirement(apiKey, null);
    }

    public static AuthRequirement basic(String username, String password) {
        return new AuthRequirement(null, new BasicAuth(username, password));
    }

    /**
     * Basic-auth credentials.
     */
    public record BasicAuth(String username, String password) {
        @Override
        public String toString() {
            return "BasicAuth[username=" + username + ", password=***]";
        }
    }

    @Override
    public String toString() {
        return "AuthRequirement[apiKey=" + (hasApiKey() ? "***" : "none")
                + ", basicAuth=" + basicAuth + "]";
    }
}
