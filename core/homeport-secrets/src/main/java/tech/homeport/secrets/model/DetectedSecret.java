package tech.homeport.secrets.model;

import lombok.Builder;
import lombok.With;

import java.util.List;

/**
 * Candidate secret proposed by a detector for one resource, before deduplication.
 *
 * @param deduplicationKey identity used to merge candidates across resources; derived when null
 */
@Builder(toBuilder = true)
@With
public record DetectedSecret(
    String name,
    SecretSource source,
    String key,
    String description,
    boolean required,
    SecretType type,
    String version,
    String resourceId,
    String resourceName,
    String resourceType,
    String deduplicationKey
) {

    public DetectedSecret {
        key = key == null ? "" : key;
        description = description == null ? "" : description;
        type = type == null ? SecretType.GENERIC : type;
        version = version == null ? "" : version;
        resourceId = resourceId == null ? "" : resourceId;
        resourceName = resourceName == null ? "" : resourceName;
        resourceType = resourceType == null ? "" : resourceType;
    }

    /**
     * Key used to merge this candidate with others: the explicit key if set,
     * {@code source:key} for cloud store secrets, else {@code manual:name}.
     */
    public String effectiveDeduplicationKey() {
        if (deduplicationKey != null && !deduplicationKey.isEmpty()) {
            return deduplicationKey;
        }
        if (source != null && source.isCloudProvider() && !key.isEmpty()) {
            return source.value() + ":" + key;
        }
        return "manual:" + name;
    }

    /**
     * Convert to a manifest reference. Manual secrets carry no locator.
     */
    public SecretReference toSecretReference(List<String> usedBy) {
        SecretReference ref = SecretReference.of(name, source)
            .withKey(source == SecretSource.MANUAL ? "" : key)
            .withDescription(description)
            .withType(type)
            .withVersion(version);
        ref.required = required;
        if (usedBy != null) {
            usedBy.forEach(ref::addUsedBy);
        }
        return ref;
    }
}
