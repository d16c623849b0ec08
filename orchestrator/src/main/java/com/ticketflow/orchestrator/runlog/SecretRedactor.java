package com.ticketflow.orchestrator.runlog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Masks credentials in log lines, command lines and captured parameters.
 */
public final class SecretRedactor {

    public static final String REDACTED = "[REDACTED]";

    private record Rule(Pattern pattern, String replacement) {}

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("Authorization:\\s*Bearer\\s+\\S+", Pattern.CASE_INSENSITIVE),
                    "Authorization: Bearer " + REDACTED),
            new Rule(Pattern.compile("Authorization:\\s*Basic\\s+\\S+", Pattern.CASE_INSENSITIVE),
                    "Authorization: Basic " + REDACTED),
            new Rule(Pattern.compile("token[=:]\\s*[^\\s&]+", Pattern.CASE_INSENSITIVE), "token=" + REDACTED),
            new Rule(Pattern.compile("key[=:]\\s*[^\\s&]+", Pattern.CASE_INSENSITIVE), "key=" + REDACTED),
            new Rule(Pattern.compile("password[=:]\\s*[^\\s&]+", Pattern.CASE_INSENSITIVE), "password=" + REDACTED),
            new Rule(Pattern.compile("secret[=:]\\s*[^\\s&]+", Pattern.CASE_INSENSITIVE), "secret=" + REDACTED));

    private static final List<String> SENSITIVE_KEYS = List.of("token", "key", "password", "secret");

    private SecretRedactor() {}

    public static String redact(String text) {
        if (text == null || text.isEmpty()) return text;
        String out = text;
        for (Rule rule : RULES) {
            out = rule.pattern().matcher(out).replaceAll(rule.replacement());
        }
        return out;
    }

    /** Copy of {@code parameters} with the values of credential-like keys masked. */
    public static Map<String, String> redactParameters(Map<String, String> parameters) {
        Map<String, String> out = new LinkedHashMap<>();
        parameters.forEach((k, v) -> out.put(k, isSensitiveKey(k) ? REDACTED : v));
        return out;
    }

    static boolean isSensitiveKey(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEYS.stream().anyMatch(lower::contains);
    }
}
