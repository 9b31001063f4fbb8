package tech.homeport.secrets.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * A secret that must be provided at deploy time.
 *
 * IMPORTANT: A reference describes where a value lives, never the value
 * itself. References are safe to persist in a manifest snapshot.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class SecretReference {

    private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*$");

    /**
     * Environment variable style identifier, unique within a manifest.
     */
    @JsonProperty("name")
    public String name;

    @JsonProperty("source")
    public SecretSource source;

    /**
     * Provider specific locator (ARN, path, vault/secret). Empty for manual secrets.
     */
    @JsonProperty("key")
    public String key = "";

    @JsonProperty("description")
    public String description = "";

    @JsonProperty("required")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public boolean required = true;

    /**
     * Names of the services consuming this secret, in first-seen order.
     */
    @JsonProperty("used_by")
    public List<String> usedBy = new ArrayList<>();

    @JsonProperty("type")
    public SecretType type = SecretType.GENERIC;

    @JsonProperty("version")
    public String version = "";

    @JsonProperty("encoding")
    public SecretEncoding encoding;

    public SecretReference() {
    }

    public SecretReference(String name, SecretSource source) {
        this.name = name;
        this.source = source;
    }

    public static SecretReference of(String name, SecretSource source) {
        return new SecretReference(name, source);
    }

    public SecretReference withKey(String key) {
        this.key = key == null ? "" : key;
        return this;
    }

    public SecretReference withDescription(String description) {
        this.description = description == null ? "" : description;
        return this;
    }

    public SecretReference withType(SecretType type) {
        this.type = type == null ? SecretType.GENERIC : type;
        return this;
    }

    public SecretReference withVersion(String version) {
        this.version = version == null ? "" : version;
        return this;
    }

    public SecretReference withEncoding(SecretEncoding encoding) {
        this.encoding = encoding;
        return this;
    }

    public SecretReference optional() {
        this.required = false;
        return this;
    }

    /**
     * Record a consumer. Already listed consumers are ignored.
     */
    public SecretReference addUsedBy(String service) {
        if (service != null && !service.isEmpty() && !usedBy.contains(service)) {
            usedBy.add(service);
        }
        return this;
    }

    @JsonIgnore
    public boolean hasKey() {
        return key != null && !key.isEmpty();
    }

    /**
     * Check name, source and key.
     *
     * @throws SecretException with kind EMPTY_NAME, INVALID_NAME, INVALID_SOURCE or MISSING_KEY
     */
    public void validate() {
        if (name == null || name.isEmpty()) {
            throw new SecretException(SecretErrorKind.EMPTY_NAME, "secret name cannot be empty");
        }
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new SecretException(SecretErrorKind.INVALID_NAME, name,
                "invalid secret name: " + name + " (must match ^[A-Z][A-Z0-9_]*$)");
        }
        if (source == null) {
            throw new SecretException(SecretErrorKind.INVALID_SOURCE, name, "invalid secret source for " + name);
        }
        if (source != SecretSource.MANUAL && !hasKey()) {
            throw new SecretException(SecretErrorKind.MISSING_KEY, name,
                "secret key is required for non-manual sources: " + name);
        }
    }

    public static boolean isValidName(String name) {
        return name != null && NAME_PATTERN.matcher(name).matches();
    }

    public SecretReference copy() {
        SecretReference copy = new SecretReference(name, source);
        copy.key = key;
        copy.description = description;
        copy.required = required;
        copy.usedBy = new ArrayList<>(usedBy);
        copy.type = type;
        copy.version = version;
        copy.encoding = encoding;
        return copy;
    }

    @Override
    public String toString() {
        return "SecretReference{name=" + name + ", source=" + source + ", required=" + required + "}";
    }
}
