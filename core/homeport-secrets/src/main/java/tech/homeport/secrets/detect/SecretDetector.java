package tech.homeport.secrets.detect;

import tech.homeport.secrets.model.DetectedSecret;
import tech.homeport.secrets.resource.CloudProvider;
import tech.homeport.secrets.resource.CloudResource;
import tech.homeport.secrets.resource.ResourceType;

import java.util.List;
import java.util.Set;

/**
 * Inspects one resource and proposes the secrets it implies.
 *
 * Detectors are registered with a {@link DetectorRegistry}, which routes
 * resources by provider and type and merges the results into a manifest.
 */
public interface SecretDetector {

    /**
     * Analyze a resource.
     *
     * @param resource resource of one of the {@link #supportedTypes()}
     * @return candidates, empty when the resource implies no secrets
     * @throws tech.homeport.secrets.errors.SecretDetectionException if the resource cannot be interpreted
     */
    List<DetectedSecret> detect(CloudResource resource);

    /**
     * Resource types this detector handles.
     */
    Set<ResourceType> supportedTypes();

    /**
     * Cloud provider of the supported types.
     */
    CloudProvider provider();
}
