package tech.homeport.secrets.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of value a secret holds. Used for prompts, masking and documentation.
 */
public enum SecretType {
    PASSWORD("password"),
    API_KEY("api_key"),
    CERTIFICATE("certificate"),
    PRIVATE_KEY("private_key"),
    CONNECTION_STRING("connection_string"),
    GENERIC("generic");

    private final String value;

    SecretType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Whether values of this type should not be echoed on input.
     */
    public boolean isMasked() {
        return this == PASSWORD || this == API_KEY || this == PRIVATE_KEY;
    }

    /**
     * Parse a wire value; unknown or empty values map to {@link #GENERIC}.
     */
    @JsonCreator
    public static SecretType parse(String value) {
        if (value != null) {
            for (SecretType type : values()) {
                if (type.value.equals(value)) {
                    return type;
                }
            }
        }
        return GENERIC;
    }

    @Override
    public String toString() {
        return value;
    }
}
