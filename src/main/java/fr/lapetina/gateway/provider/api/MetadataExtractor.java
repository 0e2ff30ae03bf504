package fr.lapetina.gateway.provider.api;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns query parameters and prefixed headers into request metadata.
 *
 * <p>Query parameters contribute their first value. Headers whose name starts
 * with the prefix (case-insensitive) contribute their first value under the
 * remaining name. All keys are lower-cased; headers win over query parameters.
 */
public final class MetadataExtractor {

    private final String headerPrefix;
    private final boolean includeQueryParameters;

    public MetadataExtractor(String headerPrefix, boolean includeQueryParameters) {
        this.headerPrefix = headerPrefix;
        this.includeQueryParameters = includeQueryParameters;
    }

    public Map<String, String> extract(String rawQuery, Map<String, List<String>> headers) {
        Map<String, String> metadata = new LinkedHashMap<>();

        if (includeQueryParameters && rawQuery != null && !rawQuery.isEmpty()) {
            for (String pair : rawQuery.split("&")) {
                if (pair.isEmpty()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                String key = decode(eq >= 0 ? pair.substring(0, eq) : pair);
                String value = eq >= 0 ? decode(pair.substring(eq + 1)) : "";
                if (!key.isEmpty()) {
                    metadata.putIfAbsent(key.toLowerCase(Locale.ROOT), value);
                }
            }
        }

        if (headers != null) {
            for (Map.Entry<String, List<String>> header : headers.entrySet()) {
                String name = header.getKey();
                List<String> values = header.getValue();
                if (name == null || values == null || values.isEmpty()) {
                    continue;
                }
                if (name.length() > headerPrefix.length()
                        && name.regionMatches(true, 0, headerPrefix, 0, headerPrefix.length())) {
                    String key = name.substring(headerPrefix.length()).toLowerCase(Locale.ROOT);
                    metadata.put(key, values.get(0));
                }
            }
        }

        return metadata;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            // Malformed escapes are kept verbatim
            return value;
        }
    }
}
