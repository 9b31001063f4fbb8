package tech.homeport.secrets.resolve;

import tech.homeport.secrets.errors.SecretResolutionException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a batch fetch, keyed by secret name. Values are sensitive.
 */
public record BatchResult(
    Map<String, String> secrets,
    Map<String, SecretResolutionException> errors
) {

    public BatchResult {
        secrets = Collections.unmodifiableMap(new LinkedHashMap<>(secrets));
        errors = Collections.unmodifiableMap(new LinkedHashMap<>(errors));
    }

    public static BatchResult empty() {
        return new BatchResult(Map.of(), Map.of());
    }

    @Override
    public String toString() {
        return "BatchResult{resolved=" + secrets.keySet() + ", errors=" + errors.keySet() + "}";
    }
}
