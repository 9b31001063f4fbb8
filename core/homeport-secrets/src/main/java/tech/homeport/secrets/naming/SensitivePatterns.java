package tech.homeport.secrets.naming;

import tech.homeport.secrets.model.SecretType;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Name based heuristics for spotting sensitive configuration values.
 */
public final class SensitivePatterns {

    private static final List<Pattern> PATTERNS = List.of(
        Pattern.compile("PASSWORD", Pattern.CASE_INSENSITIVE),
        Pattern.compile("SECRET", Pattern.CASE_INSENSITIVE),
        Pattern.compile("API[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("TOKEN", Pattern.CASE_INSENSITIVE),
        Pattern.compile("CREDENTIAL", Pattern.CASE_INSENSITIVE),
        Pattern.compile("AUTH", Pattern.CASE_INSENSITIVE),
        Pattern.compile("PRIVATE[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("ACCESS[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("CLIENT[_-]?SECRET", Pattern.CASE_INSENSITIVE),
        Pattern.compile("ENCRYPTION[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("SIGNING[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("MASTER[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("DB[_-]?PASS", Pattern.CASE_INSENSITIVE),
        Pattern.compile("DATABASE[_-]?PASS", Pattern.CASE_INSENSITIVE),
        Pattern.compile("CERT", Pattern.CASE_INSENSITIVE),
        Pattern.compile("SSH[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("RSA[_-]?KEY", Pattern.CASE_INSENSITIVE),
        Pattern.compile("JWT[_-]?SECRET", Pattern.CASE_INSENSITIVE),
        Pattern.compile("HMAC", Pattern.CASE_INSENSITIVE),
        Pattern.compile("BEARER", Pattern.CASE_INSENSITIVE)
    );

    private static final Set<String> EXPLICIT_NAMES = Set.of(
        "PASSWORD", "SECRET", "API_KEY", "APIKEY", "TOKEN", "AUTH_TOKEN", "ACCESS_TOKEN",
        "REFRESH_TOKEN", "PRIVATE_KEY", "SECRET_KEY", "ENCRYPTION_KEY", "MASTER_PASSWORD",
        "DB_PASSWORD", "DATABASE_PASSWORD", "REDIS_PASSWORD", "POSTGRES_PASSWORD",
        "MYSQL_PASSWORD", "MONGO_PASSWORD", "JWT_SECRET", "SESSION_SECRET", "COOKIE_SECRET",
        "SIGNING_KEY", "SSH_KEY", "SSH_PRIVATE_KEY", "TLS_KEY", "SSL_KEY"
    );

    private SensitivePatterns() {
    }

    /**
     * Whether an environment variable name likely holds a secret.
     */
    public static boolean isSensitiveEnvName(String name) {
        if (name == null || name.isEmpty()) {
            return false;
        }
        if (EXPLICIT_NAMES.contains(name.toUpperCase(Locale.ROOT))) {
            return true;
        }
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(name).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Guess the secret type from a name. First matching rule wins.
     */
    public static SecretType inferSecretType(String name) {
        String upper = name == null ? "" : name.toUpperCase(Locale.ROOT);

        if (containsAny(upper, "PASSWORD", "PASSWD")) {
            return SecretType.PASSWORD;
        }
        if (containsAny(upper, "API_KEY", "APIKEY", "TOKEN")) {
            return SecretType.API_KEY;
        }
        if (upper.contains("CERT")) {
            return SecretType.CERTIFICATE;
        }
        if (containsAny(upper, "PRIVATE_KEY", "SSH_KEY", "RSA_KEY", "TLS_KEY")) {
            return SecretType.PRIVATE_KEY;
        }
        if (containsAny(upper, "CONNECTION_STRING", "DATABASE_URL", "DB_URL", "REDIS_URL")) {
            return SecretType.CONNECTION_STRING;
        }
        return SecretType.GENERIC;
    }

    private static boolean containsAny(String value, String... needles) {
        for (String needle : needles) {
            if (value.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
