package tech.homeport.secrets.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretException;

/**
 * Where the value of a secret lives.
 */
public enum SecretSource {
    /** Supplied by the operator at deploy time. */
    MANUAL("manual"),
    /** Read from an environment variable named by the key. */
    ENV("env"),
    /** Read from a local file. */
    FILE("file"),
    AWS_SECRETS_MANAGER("aws-secrets-manager"),
    GCP_SECRET_MANAGER("gcp-secret-manager"),
    AZURE_KEY_VAULT("azure-key-vault"),
    HASHICORP_VAULT("hashicorp-vault");

    private final String value;

    SecretSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * True for the managed cloud secret stores.
     */
    public boolean isCloudProvider() {
        return this == AWS_SECRETS_MANAGER || this == GCP_SECRET_MANAGER || this == AZURE_KEY_VAULT;
    }

    /**
     * True when reading from this source needs credentials for an external store.
     */
    public boolean requiresCredentials() {
        return isCloudProvider() || this == HASHICORP_VAULT;
    }

    /**
     * Parse the wire value of a source.
     *
     * @throws SecretException with kind {@link SecretErrorKind#INVALID_SOURCE} for unknown values
     */
    @JsonCreator
    public static SecretSource parse(String value) {
        if (value != null) {
            for (SecretSource source : values()) {
                if (source.value.equals(value)) {
                    return source;
                }
            }
        }
        throw new SecretException(SecretErrorKind.INVALID_SOURCE, "invalid secret source: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
