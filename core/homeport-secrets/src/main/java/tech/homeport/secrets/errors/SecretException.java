package tech.homeport.secrets.errors;

import java.util.Optional;

/**
 * Base exception of the secrets engine. Carries a {@link SecretErrorKind} and,
 * where one applies, the name of the secret involved.
 */
public class SecretException extends RuntimeException {

    private final SecretErrorKind kind;
    private final String secretName;

    public SecretException(SecretErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public SecretException(SecretErrorKind kind, String secretName, String message) {
        this(kind, secretName, message, null);
    }

    public SecretException(SecretErrorKind kind, String secretName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.secretName = secretName;
    }

    public SecretErrorKind kind() {
        return kind;
    }

    public Optional<String> secretName() {
        return Optional.ofNullable(secretName);
    }

    public boolean is(SecretErrorKind expected) {
        return kind == expected;
    }
}
