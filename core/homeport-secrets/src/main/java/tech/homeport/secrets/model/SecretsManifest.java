package tech.homeport.secrets.model;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The set of secrets a migrated stack needs, keyed by unique name.
 *
 * Required count and source set are derived from the entries on every read,
 * so changing {@link SecretReference#required} after insertion stays consistent.
 */
@JsonAutoDetect(getterVisibility = Visibility.NONE, isGetterVisibility = Visibility.NONE)
@JsonIgnoreProperties(value = {"required_count", "sources"}, allowGetters = true)
public class SecretsManifest {

    public static final String CURRENT_VERSION = "1.0.0";

    private final String version;
    private final List<SecretReference> secrets = new ArrayList<>();

    public SecretsManifest() {
        this(CURRENT_VERSION);
    }

    public SecretsManifest(String version) {
        this.version = version == null || version.isEmpty() ? CURRENT_VERSION : version;
    }

    /**
     * Rebuild a manifest from a snapshot. Every entry goes through {@link #addSecret}.
     */
    @JsonCreator
    public static SecretsManifest fromSnapshot(
            @JsonProperty("version") String version,
            @JsonProperty("secrets") List<SecretReference> secrets) {
        SecretsManifest manifest = new SecretsManifest(version);
        if (secrets != null) {
            for (SecretReference ref : secrets) {
                manifest.addSecret(ref);
            }
        }
        return manifest;
    }

    @JsonProperty("version")
    public String version() {
        return version;
    }

    @JsonProperty("secrets")
    public List<SecretReference> secrets() {
        return Collections.unmodifiableList(secrets);
    }

    /**
     * Validate and append a reference.
     *
     * @throws SecretException with a validation kind, or DUPLICATE_NAME when the name is taken
     */
    public void addSecret(SecretReference ref) {
        if (ref == null) {
            throw new SecretException(SecretErrorKind.EMPTY_NAME, "secret reference cannot be null");
        }
        ref.validate();
        if (contains(ref.name)) {
            throw new SecretException(SecretErrorKind.DUPLICATE_NAME, ref.name,
                "duplicate secret name: " + ref.name);
        }
        secrets.add(ref);
    }

    public boolean contains(String name) {
        return getSecret(name).isPresent();
    }

    public Optional<SecretReference> getSecret(String name) {
        return secrets.stream().filter(s -> s.name.equals(name)).findFirst();
    }

    public List<SecretReference> getRequired() {
        return secrets.stream().filter(s -> s.required).collect(Collectors.toList());
    }

    public List<SecretReference> getBySource(SecretSource source) {
        return secrets.stream().filter(s -> s.source == source).collect(Collectors.toList());
    }

    public List<SecretReference> getCloudSecrets() {
        return secrets.stream().filter(s -> s.source.isCloudProvider()).collect(Collectors.toList());
    }

    @JsonProperty("required_count")
    public int requiredCount() {
        return (int) secrets.stream().filter(s -> s.required).count();
    }

    /**
     * Distinct sources in enum order.
     */
    @JsonProperty("sources")
    public Set<SecretSource> sources() {
        Set<SecretSource> sources = EnumSet.noneOf(SecretSource.class);
        secrets.forEach(s -> sources.add(s.source));
        return sources;
    }

    public int size() {
        return secrets.size();
    }

    public boolean isEmpty() {
        return secrets.isEmpty();
    }

    public void sortByName() {
        secrets.sort(Comparator.comparing(s -> s.name));
    }

    /**
     * Re-check every entry, including entries mutated after insertion.
     */
    public void validate() {
        Set<String> seen = new HashSet<>();
        for (SecretReference ref : secrets) {
            ref.validate();
            if (!seen.add(ref.name)) {
                throw new SecretException(SecretErrorKind.DUPLICATE_NAME, ref.name,
                    "duplicate secret name: " + ref.name);
            }
        }
    }

    /**
     * Content of a {@code .env.template} file listing every secret with empty values.
     */
    public String generateEnvTemplate() {
        StringBuilder sb = new StringBuilder();
        sb.append("# Environment Variables Template\n");
        sb.append("# Generated by Homeport - DO NOT commit actual values\n");
        sb.append("#\n");
        sb.append("# Instructions:\n");
        sb.append("# 1. Copy this file to .env\n");
        sb.append("# 2. Fill in the actual secret values\n");
        sb.append("# 3. Keep .env out of version control\n");
        sb.append("#\n\n");

        for (SecretReference s : secrets) {
            if (s.description != null && !s.description.isEmpty()) {
                sb.append("# ").append(s.description).append('\n');
            }
            sb.append(s.required ? "# REQUIRED\n" : "# OPTIONAL\n");
            if (s.source != SecretSource.MANUAL) {
                sb.append("# Source: ").append(s.source.value()).append('\n');
                if (s.hasKey()) {
                    sb.append("# Key: ").append(s.key).append('\n');
                }
            }
            sb.append(s.name).append("=\n\n");
        }
        return sb.toString();
    }
}
