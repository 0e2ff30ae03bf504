package fr.lapetina.gateway.provider.api;

import fr.lapetina.gateway.provider.domain.exception.AuthenticationException;
import fr.lapetina.gateway.provider.domain.model.AuthRequirement;
import fr.lapetina.gateway.provider.domain.model.ConfigurationSource;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Checks request credentials against a source's {@link AuthRequirement}.
 *
 * <p>An open requirement allows everything. Otherwise the request passes when
 * its {@code X-API-Key} header matches the configured key, or when its
 * {@code Authorization: Basic} credentials match the configured pair.
 */
public final class Authenticator {

    public static final String API_KEY_HEADER = "X-API-Key";
    public static final String AUTHORIZATION_HEADER = "Authorization";
    private static final String BASIC_PREFIX = "Basic ";

    public boolean isAllowed(AuthRequirement requirement, Credentials credentials) {
        if (requirement == null || requirement.isOpen()) {
            return true;
        }
        if (requirement.hasApiKey() && credentials.apiKey() != null
                && constantTimeEquals(requirement.apiKey(), credentials.apiKey())) {
            return true;
        }
        AuthRequirement.BasicAuth basic = requirement.basicAuth();
        return basic != null && credentials.username() != null
                && constantTimeEquals(basic.username(), credentials.username())
                && constantTimeEquals(basic.password(), credentials.password());
    }

    /**
     * @throws AuthenticationException if the credentials do not satisfy the source
     */
    public void authenticate(ConfigurationSource source, Credentials credentials) {
        if (!isAllowed(source.getAuthRequirement(), credentials)) {
            throw new AuthenticationException(source.getId());
        }
    }

    private static boolean constantTimeEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                actual.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Credentials presented by a request. Any part may be null.
     */
    public record Credentials(String apiKey, String username, String password) {

        public static Credentials none() {
            return new Credentials(null, null, null);
        }

        /**
         * Reads {@code X-API-Key} and {@code Authorization: Basic} from request headers.
         * Header names are matched case-insensitively.
         */
        public static Credentials fromHeaders(Map<String, List<String>> headers) {
            String apiKey = firstHeader(headers, API_KEY_HEADER);
            String username = null;
            String password = null;

            String authorization = firstHeader(headers, AUTHORIZATION_HEADER);
            if (authorization != null
                    && authorization.regionMatches(true, 0, BASIC_PREFIX, 0, BASIC_PREFIX.length())) {
                try {
                    String decoded = new String(
                            Base64.getDecoder().decode(authorization.substring(BASIC_PREFIX.length()).trim()),
                            StandardCharsets.UTF_8);
                    int colon = decoded.indexOf(':');
                    if (colon >= 0) {
                        username = decoded.substring(0, colon);
                        password = decoded.substring(colon + 1);
                    }
                } catch (IllegalArgumentException e) {
                    // Not valid base64: treated as absent credentials
                    username = null;
                }
            }
            return new Credentials(apiKey, username, password);
        }

        private static String firstHeader(Map<String, List<String>> headers, String name) {
            if (headers == null) {
                return null;
            }
            for (Map.Entry<String, List<String>> header : headers.entrySet()) {
                if (name.equalsIgnoreCase(header.getKey()) && header.getValue() != null
                        && !header.getValue().isEmpty()) {
                    return header.getValue().get(0);
                }
            }
            return null;
        }

        @Override
        public String toString() {
            return "Credentials[apiKey=" + (apiKey != null ? "***" : "none") + ", username=" + username + "]";
        }
    }
}
