package tech.homeport.secrets.resolve;

import tech.homeport.secrets.model.SecretReference;
import tech.homeport.secrets.model.SecretsManifest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of {@link SecretResolver#checkResolvability(SecretsManifest)}, in manifest order.
 */
public final class ResolvabilityReport {

    private final Map<String, ResolvabilityStatus> secrets = new LinkedHashMap<>();

    void put(String name, ResolvabilityStatus status) {
        secrets.put(name, status);
    }

    public Map<String, ResolvabilityStatus> secrets() {
        return Collections.unmodifiableMap(secrets);
    }

    public ResolvabilityStatus statusOf(String name) {
        return secrets.get(name);
    }

    public List<String> resolvable() {
        return namesIn(ResolvabilityState.RESOLVABLE);
    }

    public List<String> maybeResolvable() {
        return namesIn(ResolvabilityState.MAYBE_RESOLVABLE);
    }

    public List<String> needsInteractive() {
        return namesIn(ResolvabilityState.NEEDS_INTERACTIVE);
    }

    public List<String> unresolvable() {
        return namesIn(ResolvabilityState.UNRESOLVABLE);
    }

    /**
     * True when no required secret of the manifest is unresolvable.
     * Optional secrets are not considered.
     */
    public boolean canResolveAll(SecretsManifest manifest) {
        for (SecretReference ref : manifest.getRequired()) {
            ResolvabilityStatus status = secrets.get(ref.name);
            if (status == null || status.state() == ResolvabilityState.UNRESOLVABLE) {
                return false;
            }
        }
        return true;
    }

    private List<String> namesIn(ResolvabilityState state) {
        return secrets.entrySet().stream()
            .filter(e -> e.getValue().state() == state)
            .map(Map.Entry::getKey)
            .collect(Collectors.toList());
    }
}
