package tech.homeport.secrets.detect;

import tech.homeport.secrets.model.DetectedSecret;
import tech.homeport.secrets.model.SecretSource;
import tech.homeport.secrets.model.SecretType;
import tech.homeport.secrets.resource.CloudProvider;
import tech.homeport.secrets.resource.CloudResource;
import tech.homeport.secrets.resource.ResourceType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Base class for per-provider detectors. Subclasses register one handler per
 * resource type; {@link #detect} dispatches on the resource type.
 */
public abstract class AbstractSecretDetector implements SecretDetector {

    private final CloudProvider provider;
    private final Map<ResourceType, Function<CloudResource, List<DetectedSecret>>> handlers = new LinkedHashMap<>();

    protected AbstractSecretDetector(CloudProvider provider) {
        this.provider = provider;
    }

    protected final void on(ResourceType type, Function<CloudResource, List<DetectedSecret>> handler) {
        handlers.put(type, handler);
    }

    @Override
    public List<DetectedSecret> detect(CloudResource resource) {
        Function<CloudResource, List<DetectedSecret>> handler = handlers.get(resource.type());
        if (handler == null) {
            return List.of();
        }
        return handler.apply(resource);
    }

    @Override
    public Set<ResourceType> supportedTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    @Override
    public CloudProvider provider() {
        return provider;
    }

    /**
     * Builder prefilled with the resource identity, marked required.
     */
    protected static DetectedSecret.DetectedSecretBuilder candidate(CloudResource resource) {
        return DetectedSecret.builder()
            .required(true)
            .resourceId(resource.id())
            .resourceName(resource.displayName())
            .resourceType(resource.type().value());
    }

    /**
     * A secret the operator supplies by hand.
     */
    protected static DetectedSecret manual(CloudResource resource, String name, SecretType type, String description) {
        return candidate(resource)
            .name(name)
            .source(SecretSource.MANUAL)
            .type(type)
            .description(description)
            .build();
    }

    /**
     * A secret held in an external store, deduplicated on {@code source:key}.
     */
    protected static DetectedSecret stored(CloudResource resource, SecretSource source, String name, String key,
                                           SecretType type, String description) {
        return candidate(resource)
            .name(name)
            .source(source)
            .key(key)
            .type(type)
            .description(description)
            .deduplicationKey(source.value() + ":" + key)
            .build();
    }
}
