package com.aegis.events;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credential-like values in audit details before they are checksummed and persisted.
 *
 * <p>Failure metrics sometimes carry the probe's connection string or auth header. Matching is
 * a case-insensitive substring match on the detail key.
 */
public final class DetailRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_KEYS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "credential", "connectionstring"
    );

    private final Pattern compiledPattern;

    public DetailRedactor() {
        this(DEFAULT_SENSITIVE_KEYS);
    }

    /**
     * @param sensitiveKeys key fragments whose values must never leave the governor
     */
    public DetailRedactor(Set<String> sensitiveKeys) {
        if (sensitiveKeys == null || sensitiveKeys.isEmpty()) {
            throw new IllegalArgumentException("sensitiveKeys must not be null or empty");
        }
        String regex = String.join("|", sensitiveKeys.stream().map(Pattern::quote).toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a copy of {@code details} with sensitive values replaced by {@value #REDACTED}.
     * Null values become empty strings so the checksum input is always well defined.
     */
    public Map<String, String> redact(Map<String, String> details) {
        if (details == null || details.isEmpty()) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>(details.size());
        details.forEach((key, value) -> {
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else {
                result.put(key, value == null ? "" : value);
            }
        });
        return result;
    }

    public boolean isSensitive(String key) {
        return key != null && compiledPattern.matcher(key).find();
    }
}
