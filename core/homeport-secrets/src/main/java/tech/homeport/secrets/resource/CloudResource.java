package tech.homeport.secrets.resource;

import java.util.Map;
import java.util.Objects;

/**
 * A discovered cloud resource as seen by the secret detectors.
 *
 * @param id     provider-assigned identifier
 * @param name   human readable name, may be blank
 * @param type   resource type
 * @param arn    provider resource name, may be null
 * @param attributes untyped configuration bag, read through {@link #config()}
 */
public record CloudResource(
    String id,
    String name,
    ResourceType type,
    String arn,
    Map<String, Object> attributes
) {

    public CloudResource {
        Objects.requireNonNull(type, "type");
        id = id == null ? "" : id;
        name = name == null ? "" : name;
        attributes = attributes == null ? Map.of() : attributes;
    }

    public static CloudResource of(String id, String name, ResourceType type, Map<String, Object> attributes) {
        return new CloudResource(id, name, type, null, attributes);
    }

    /**
     * Typed view over the configuration bag.
     */
    public ResourceConfig config() {
        return new ResourceConfig(attributes);
    }

    /**
     * Name to use when reporting this resource; falls back to the id.
     */
    public String displayName() {
        return name.isBlank() ? id : name;
    }
}
