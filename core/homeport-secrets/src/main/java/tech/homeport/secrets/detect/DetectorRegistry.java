package tech.homeport.secrets.detect;

import org.jboss.logging.Logger;
import tech.homeport.secrets.errors.SecretErrorKind;
import tech.homeport.secrets.errors.SecretException;
import tech.homeport.secrets.model.DetectedSecret;
import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretsManifest;
import tech.homeport.secrets.resource.CloudProvider;
import tech.homeport.secrets.resource.CloudResource;
import tech.homeport.secrets.resource.ResourceType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Routes resources to detectors and merges their candidates into a manifest.
 *
 * Candidates sharing a deduplication key collapse into one manifest entry
 * whose consumers are the union of the originating resources (first-seen order)
 * and which is required if any candidate was required. Detection is best effort:
 * a failing detector is logged and the scan continues.
 *
 * Registration is thread-safe. A scan itself runs sequentially.
 */
public class DetectorRegistry {

    private static final Logger LOG = Logger.getLogger(DetectorRegistry.class);

    private final Map<CloudProvider, Map<ResourceType, SecretDetector>> detectors = new EnumMap<>(CloudProvider.class);

    /**
     * Registry with the AWS, GCP and Azure detectors.
     */
    public static DetectorRegistry withDefaults() {
        DetectorRegistry registry = new DetectorRegistry();
        registry.register(new AwsSecretDetector());
        registry.register(new GcpSecretDetector());
        registry.register(new AzureSecretDetector());
        return registry;
    }

    /**
     * Register a detector for all of its types. A later registration for the
     * same type replaces the earlier one.
     */
    public synchronized void register(SecretDetector detector) {
        Map<ResourceType, SecretDetector> byType =
            detectors.computeIfAbsent(detector.provider(), p -> new HashMap<>());
        for (ResourceType type : detector.supportedTypes()) {
            SecretDetector previous = byType.put(type, detector);
            if (previous != null && previous != detector) {
                LOG.debugf("Replacing detector for %s: %s -> %s", type,
                    previous.getClass().getSimpleName(), detector.getClass().getSimpleName());
            }
        }
    }

    public synchronized Optional<SecretDetector> getDetector(ResourceType type) {
        return type.provider()
            .map(detectors::get)
            .map(byType -> byType.get(type));
    }

    /**
     * Scan the resources and return the manifest only.
     */
    public SecretsManifest detectAll(List<CloudResource> resources) {
        return scan(resources).manifest();
    }

    /**
     * Scan the resources and return the manifest together with detector
     * failures and dropped candidates.
     */
    public DetectionReport scan(List<CloudResource> resources) {
        Map<String, Accumulated> byKey = new LinkedHashMap<>();
        List<DetectionFailure> failures = new ArrayList<>();

        for (CloudResource resource : resources) {
            Optional<SecretDetector> detector = getDetector(resource.type());
            if (detector.isEmpty()) {
                continue;
            }

            List<DetectedSecret> detected;
            try {
                detected = detector.get().detect(resource);
            } catch (RuntimeException e) {
                LOG.warnf(e, "Secret detection failed for resource %s (%s), continuing",
                    resource.id(), resource.type());
                failures.add(new DetectionFailure(resource.id(), resource.type().value(), e.getMessage()));
                continue;
            }
            if (detected == null) {
                continue;
            }

            for (DetectedSecret secret : detected) {
                String key = secret.effectiveDeduplicationKey();
                Accumulated existing = byKey.get(key);
                if (existing == null) {
                    Accumulated entry = new Accumulated(secret);
                    entry.addConsumer(resource.name());
                    byKey.put(key, entry);
                } else {
                    existing.addConsumer(resource.name());
                    if (secret.required() && !existing.secret.required()) {
                        existing.secret = existing.secret.withRequired(true);
                    }
                }
            }
        }

        SecretsManifest manifest = new SecretsManifest();
        List<DetectedSecret> dropped = new ArrayList<>();
        byKey.forEach((key, entry) -> {
            if (!insert(manifest, key, entry)) {
                dropped.add(entry.secret);
            }
        });
        manifest.sortByName();

        LOG.infof("Detected %d secrets (%d required) across %d resources",
            manifest.size(), manifest.requiredCount(), resources.size());
        return new DetectionReport(manifest, failures, dropped);
    }

    private boolean insert(SecretsManifest manifest, String dedupKey, Accumulated entry) {
        SecretReference ref = entry.secret.toSecretReference(entry.usedBy);
        try {
            manifest.addSecret(ref);
            return true;
        } catch (SecretException e) {
            if (!e.is(SecretErrorKind.DUPLICATE_NAME)) {
                LOG.warnf("Skipping detected secret %s from resource %s: %s",
                    ref.name, entry.secret.resourceId(), e.getMessage());
                return false;
            }
        }

        String originalName = ref.name;
        ref.name = originalName + "_" + resourceSuffix(entry.secret.resourceId());
        try {
            manifest.addSecret(ref);
            LOG.debugf("Renamed colliding secret %s to %s", originalName, ref.name);
            return true;
        } catch (SecretException e) {
            LOG.errorf("Dropping secret %s: name collides after rename to %s (dedup key %s, resource %s, kind %s)",
                originalName, ref.name, dedupKey, entry.secret.resourceId(), e.kind());
            return false;
        }
    }

    /**
     * First four characters of the resource id, uppercased, limited to name-safe characters.
     */
    static String resourceSuffix(String resourceId) {
        String prefix = resourceId.substring(0, Math.min(4, resourceId.length())).toUpperCase(Locale.ROOT);
        return prefix.replaceAll("[^A-Z0-9_]", "_");
    }

    private static final class Accumulated {
        private DetectedSecret secret;
        private final List<String> usedBy = new ArrayList<>();

        private Accumulated(DetectedSecret secret) {
            this.secret = secret;
        }

        private void addConsumer(String name) {
            if (name != null && !name.isEmpty() && !usedBy.contains(name)) {
                usedBy.add(name);
            }
        }
    }
}
