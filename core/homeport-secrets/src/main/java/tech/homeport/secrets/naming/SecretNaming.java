package tech.homeport.secrets.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Helpers that derive manifest names from resource and field names.
 */
public final class SecretNaming {

    private SecretNaming() {
    }

    /**
     * Convert an arbitrary string into an environment variable name.
     * Example: {@code my-secret-key} becomes {@code MY_SECRET_KEY}.
     */
    public static String normalizeEnvName(String name) {
        if (name == null) {
            return "";
        }
        String upper = name.replace('-', '_')
            .replace('.', '_')
            .replace('/', '_')
            .replace(' ', '_')
            .toUpperCase(Locale.ROOT);

        StringBuilder cleaned = new StringBuilder(upper.length());
        char previous = 0;
        for (int i = 0; i < upper.length(); i++) {
            char c = upper.charAt(i);
            boolean allowed = (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            if (!allowed || (c == '_' && previous == '_')) {
                continue;
            }
            cleaned.append(c);
            previous = c;
        }

        String result = trimUnderscores(cleaned.toString());
        if (!result.isEmpty() && Character.isDigit(result.charAt(0))) {
            result = "VAR_" + result;
        }
        return result;
    }

    /**
     * Build a secret name from a resource name, a resource kind hint and a field.
     * A type hint ({@code DB}, {@code CACHE}, {@code FN}) is inserted unless the
     * resource name already contains it.
     */
    public static String generateSecretName(String resourceName, String resourceKind, String fieldName) {
        String baseName = normalizeEnvName(resourceName);
        String kind = resourceKind == null ? "" : resourceKind.toLowerCase(Locale.ROOT);

        String typeHint = "";
        if (kind.contains("rds") || kind.contains("postgres") || kind.contains("mysql") || kind.contains("sql")) {
            typeHint = "DB";
        } else if (kind.contains("redis") || kind.contains("elasticache") || kind.contains("cache")) {
            typeHint = "CACHE";
        } else if (kind.contains("lambda") || kind.contains("function")) {
            typeHint = "FN";
        }

        List<String> parts = new ArrayList<>();
        if (!baseName.isEmpty()) {
            parts.add(baseName);
        }
        if (!typeHint.isEmpty() && !baseName.contains(typeHint)) {
            parts.add(typeHint);
        }
        String field = normalizeEnvName(fieldName);
        if (!field.isEmpty()) {
            parts.add(field);
        }
        return normalizeEnvName(String.join("_", parts));
    }

    /**
     * Secret name portion of a Secrets Manager ARN.
     *
     * Heuristic: AWS appends a hyphen and six random characters to secret
     * ARNs, so a trailing hyphen segment of exactly six characters is removed.
     * Names that legitimately end in a six-character segment (e.g.
     * {@code simple-secret}) lose it too. This is not a general ARN parser.
     * Values with fewer than seven colon-separated parts are returned unchanged.
     */
    public static String extractSecretKeyFromArn(String arn) {
        if (arn == null) {
            return "";
        }
        String[] parts = arn.split(":", -1);
        if (parts.length < 7) {
            return arn;
        }
        String secretPart = parts[6];
        int idx = secretPart.lastIndexOf('-');
        if (idx > 0 && secretPart.length() - idx == 7) {
            secretPart = secretPart.substring(0, idx);
        }
        return secretPart;
    }

    private static String trimUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
