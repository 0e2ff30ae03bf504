package fr.lapetina.gateway.provider.api;

/**
 * {@code If-None-Match} evaluation against a fingerprint.
 */
final class EntityTags {

    private EntityTags() {
    }

    /**
     * True when the header lists the fingerprint (quoted or bare, weak or
     * strong) or is {@code *}.
     */
    static boolean matches(String ifNoneMatch, String fingerprint) {
        if (ifNoneMatch == null || ifNoneMatch.isBlank() || fingerprint == null || fingerprint.isEmpty()) {
            return false;
        }
        for (String candidate : ifNoneMatch.split(",")) {
            String tag = candidate.trim();
            if (tag.equals("*")) {
                return true;
            }
            if (tag.startsWith("W/")) {
                tag = tag.substring(2);
            }
            if (tag.length() >= 2 && tag.startsWith("\"") && tag.endsWith("\"")) {
                tag = tag.substring(1, tag.length() - 1);
            }
            if (tag.equals(fingerprint)) {
                return true;
            }
        }
        return false;
    }
}
